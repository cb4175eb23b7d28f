package com.mainframe.fixedwidth.cli.model;

import java.nio.file.Path;

import lombok.Value;

/**
 * Command options after validation: paths normalized, requirements of the sub-command checked.
 */
@Value
public class ValidatedCommandOptions {
	Path layout;
	Path input;
	String schema;
	int offset;
}
