package com.mainframe.fixedwidth;

import com.mainframe.fixedwidth.cli.FixedWidthCommand;
import picocli.CommandLine;

/**
 * Main entry point for the fixed-width record tool.
 * Reads layout files and parses or formats fixed-width records with them.
 */
public class FixedWidthApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FixedWidthCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
