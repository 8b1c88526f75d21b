package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "reindex",
    commandDescription = "Copy the index given with --index into another index. The document source must be stored in the original index.")
public class ReindexArgs extends CommandArgs {
    @Parameter(names = { "--destination" }, required = true, description = "Name of new index")
    public String destination;
}
