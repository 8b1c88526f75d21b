package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "delete", commandDescription = "Delete the index given with --index")
public class DeleteArgs extends CommandArgs {
}
