package org.catalogsearch.ingest.commands;

import org.catalogsearch.ingest.pipeline.IngestConfig;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "promote", commandDescription = "Point the production alias at the index given with --index")
public class PromoteArgs extends CommandArgs {
    @Parameter(names = { "--prefix", "-p" }, description = "Index prefix, which is also the name of the production alias")
    public String prefix = IngestConfig.DEFAULT_PREFIX;
}
