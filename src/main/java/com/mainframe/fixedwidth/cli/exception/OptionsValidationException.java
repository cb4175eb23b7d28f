package com.mainframe.fixedwidth.cli.exception;

import java.util.List;

/**
 * Every problem found with the options of one sub-command, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final String command;
	private final List<String> errors;

	public OptionsValidationException(String command, List<String> errors) {
		super("Invalid options for '" + command + "':" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.command = command;
		this.errors = List.copyOf(errors);
	}

	public String getCommand() {
		return command;
	}

	public List<String> getErrors() {
		return errors;
	}
}
