package com.mainframe.fixedwidth.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by the sub-commands. No validation, no execution logic, no printing.
 */
@Getter
public class CommandOptions {

	@Option(names = { "--layout", "-l" }, description = "Layout file declaring the record schemas")
	private Path layout;

	@Option(names = { "--input", "-i" }, description = "Input file: raw lines for 'parse', key=value records for 'format'")
	private Path input;

	@Option(names = { "--schema", "-s" }, description = "Schema to use (default for 'parse': first schema matching each line)")
	private String schema;

	@Option(names = { "--offset" }, defaultValue = "0", description = "Character position where each record starts (default: 0)")
	private int offset;

}
