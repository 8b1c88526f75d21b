package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "ping", commandDescription = "Show the cluster name and version")
public class PingArgs extends CommandArgs {
}
