package com.mainframe.fixedwidth.exception;

import lombok.Getter;

/**
 * Syntax or declaration error in a layout file. Carries the 1-based line number.
 */
@Getter
public class LayoutParseException extends FixedWidthException {

	private static final long serialVersionUID = 1L;
	private final int line;

	public LayoutParseException(int line, String message) {
		super("Line " + line + ": " + message);
		this.line = line;
	}

	public LayoutParseException(int line, String message, Throwable cause) {
		super("Line " + line + ": " + message, cause);
		this.line = line;
	}
}
