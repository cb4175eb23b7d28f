package com.mainframe.fixedwidth.exception;

/**
 * A field, group or nested schema name collides with one already declared in the same schema.
 */
public class DuplicateNameException extends FixedWidthException {

	private static final long serialVersionUID = 1L;

	public DuplicateNameException(String message) {
		super(message);
	}
}
