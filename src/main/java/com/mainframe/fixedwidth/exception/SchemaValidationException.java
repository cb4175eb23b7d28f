package com.mainframe.fixedwidth.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.mainframe.fixedwidth.schema.SchemaProblem;

/**
 * Every problem collected by a validation pass, raised at once.
 */
public class SchemaValidationException extends SchemaException {

	private static final long serialVersionUID = 1L;
	private final transient List<SchemaProblem> problems;

	public SchemaValidationException(List<SchemaProblem> problems) {
		super(problems.stream().map(SchemaProblem::toString).collect(Collectors.joining(System.lineSeparator())));
		this.problems = List.copyOf(problems);
	}

	public List<SchemaProblem> getProblems() {
		return problems;
	}
}
