package com.localization.catalog;

import com.localization.catalog.cli.MergeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Main entry point for the PO catalog tool.
 */
@Command(
        name = "catalog-tool",
        mixinStandardHelpOptions = true,
        version = "catalog-tool 1.0.0",
        description = "Tools for gettext PO/POT catalogs.",
        subcommands = { MergeCommand.class }
)
public class CatalogToolApplication implements Runnable {

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new CatalogToolApplication())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
