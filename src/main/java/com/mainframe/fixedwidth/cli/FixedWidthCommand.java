package com.mainframe.fixedwidth.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing by itself but print usage.
 */
@Command(
        name = "fixed-width",
        mixinStandardHelpOptions = true,
        version = "fixed-width-records 1.0.0",
        description = "Parses and formats fixed-width records declared in a layout file.",
        subcommands = {
                DescribeCommand.class,
                ValidateCommand.class,
                ParseCommand.class,
                FormatCommand.class
        }
)
public class FixedWidthCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
