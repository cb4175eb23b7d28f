package com.mainframe.fixedwidth.exception;

/**
 * A column value cannot be coerced, or does not fit the column width and truncation is off.
 */
public class FieldFormatException extends FixedWidthException {

	private static final long serialVersionUID = 1L;

	public FieldFormatException(String message) {
		super(message);
	}

	public FieldFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
