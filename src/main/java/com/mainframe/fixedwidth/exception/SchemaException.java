package com.mainframe.fixedwidth.exception;

/**
 * Structural problem with a schema: unresolvable reference, recursive layout, malformed
 * declaration arguments or re-entry into setup.
 */
public class SchemaException extends FixedWidthException {

	private static final long serialVersionUID = 1L;

	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
