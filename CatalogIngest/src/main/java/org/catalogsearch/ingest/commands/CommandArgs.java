package org.catalogsearch.ingest.commands;

import com.beust.jcommander.Parameter;

public abstract class CommandArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this command")
    public boolean help;
}
