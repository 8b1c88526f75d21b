package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "indexes", commandDescription = "List the indices on the cluster")
public class IndexesArgs extends CommandArgs {
}
