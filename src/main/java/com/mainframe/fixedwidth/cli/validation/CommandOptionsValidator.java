package com.mainframe.fixedwidth.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.fixedwidth.cli.exception.OptionsValidationException;
import com.mainframe.fixedwidth.cli.model.CommandOptions;
import com.mainframe.fixedwidth.cli.model.ValidatedCommandOptions;

/**
 * Checks the shared options against what a sub-command needs, collecting every problem before
 * failing.
 */
public class CommandOptionsValidator {

	/**
	 * What a sub-command needs beyond a layout file.
	 */
	public enum Requirement {
		INPUT,
		SCHEMA
	}

	public ValidatedCommandOptions validate(String command, CommandOptions o, Requirement... requirements) {
		List<String> errors = new ArrayList<>();
		List<Requirement> required = List.of(requirements);

		Path layout = normalize(o.getLayout());
		if (layout == null) {
			errors.add("Layout file is required (--layout / -l).");
		} else if (!Files.isRegularFile(layout)) {
			errors.add("Layout file does not exist or is not a file: " + layout);
		}

		Path input = normalize(o.getInput());
		if (required.contains(Requirement.INPUT)) {
			if (input == null) {
				errors.add("Input file is required (--input / -i).");
			} else if (!Files.isRegularFile(input)) {
				errors.add("Input file does not exist or is not a file: " + input);
			}
		}

		if (required.contains(Requirement.SCHEMA) && isBlank(o.getSchema())) {
			errors.add("Schema name is required (--schema / -s).");
		}

		if (o.getOffset() < 0) {
			errors.add("Offset must be >= 0. Got: " + o.getOffset());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(command, errors);
		}

		String schema = isBlank(o.getSchema()) ? null : o.getSchema().trim();
		return new ValidatedCommandOptions(layout, input, schema, o.getOffset());
	}

	private static Path normalize(Path p) {
		return p == null ? null : p.toAbsolutePath().normalize();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
