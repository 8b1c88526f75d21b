package org.catalogsearch.ingest;

import org.catalogsearch.ingest.common.http.ConnectionContext;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

public class CatalogArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;

    @ParametersDelegate
    public ConnectionContext.ClusterArgs clusterArgs = new ConnectionContext.ClusterArgs();

    @Parameter(names = { "--index", "-i" }, description = "The index to act on; ingest names a new one when not given")
    public String index;
}
