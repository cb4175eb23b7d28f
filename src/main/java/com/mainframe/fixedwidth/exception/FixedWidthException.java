package com.mainframe.fixedwidth.exception;

/**
 * Base type for every error raised while declaring, resolving, parsing or formatting
 * fixed-width layouts.
 */
public class FixedWidthException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public FixedWidthException(String message) {
		super(message);
	}

	public FixedWidthException(String message, Throwable cause) {
		super(message, cause);
	}
}
