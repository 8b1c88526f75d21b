package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "aliases", commandDescription = "List aliases and the indices they point at")
public class AliasesArgs extends CommandArgs {
}
