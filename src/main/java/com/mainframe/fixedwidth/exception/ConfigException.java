package com.mainframe.fixedwidth.exception;

/**
 * An option is missing, unknown, read-only, or fails its validator.
 * Also raised for reserved or malformed field names.
 */
public class ConfigException extends FixedWidthException {

	private static final long serialVersionUID = 1L;

	public ConfigException(String message) {
		super(message);
	}

	public ConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
