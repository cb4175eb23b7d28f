package com.mainframe.fixedwidth.option;

import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Transforms and validators shared by the option definitions. Transforms accept both typed
 * values and their text form, so layouts read from files can pass raw strings.
 */
@UtilityClass
public class OptionRules {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public static final UnaryOperator<Object> TRIMMED = v -> v.toString().trim();

	public static final UnaryOperator<Object> TO_BOOLEAN = v -> {
		if (v instanceof Boolean) {
			return v;
		}
		String s = v.toString().trim().toLowerCase(Locale.ROOT);
		return switch (s) {
		case "true", "yes" -> Boolean.TRUE;
		case "false", "no" -> Boolean.FALSE;
		default -> throw new IllegalArgumentException("not a boolean: " + v);
		};
	};

	public static final UnaryOperator<Object> TO_INTEGER = v -> {
		if (v instanceof Integer) {
			return v;
		}
		if (v instanceof Number n) {
			return Math.toIntExact(n.longValue());
		}
		return Integer.valueOf(v.toString().trim());
	};

	/**
	 * Accepts a {@link Character} or a one-character string.
	 */
	public static final UnaryOperator<Object> TO_CHARACTER = v -> {
		if (v instanceof Character) {
			return v;
		}
		String s = v.toString();
		if (s.length() != 1) {
			throw new IllegalArgumentException("not a single character: '" + s + "'");
		}
		return s.charAt(0);
	};

	/**
	 * Accepts a {@link Predicate} over the raw line, or a regular expression that must match
	 * at the start of the line.
	 */
	public static final UnaryOperator<Object> TO_LINE_PREDICATE = v -> {
		if (v instanceof Predicate<?>) {
			return v;
		}
		Pattern pattern = Pattern.compile(v.toString());
		Predicate<String> trap = line -> pattern.matcher(line).lookingAt();
		return trap;
	};

	public static final Predicate<Object> IS_IDENTIFIER = v -> IDENTIFIER.matcher(v.toString()).matches();

	public static final Predicate<Object> IS_BOOLEAN = v -> v instanceof Boolean;

	public static final Predicate<Object> IS_POSITIVE = v -> v instanceof Integer i && i > 0;

	public static final Predicate<Object> IS_NON_NEGATIVE = v -> v instanceof Integer i && i >= 0;

	public static final Predicate<Object> IS_CHARACTER = v -> v instanceof Character;

	public static final Predicate<Object> IS_FUNCTION = v -> v instanceof Function<?, ?>;

	public static final Predicate<Object> IS_PREDICATE = v -> v instanceof Predicate<?>;

	public static boolean isIdentifier(String name) {
		return name != null && IDENTIFIER.matcher(name).matches();
	}

	/**
	 * Case-insensitive conversion of a name to a constant of {@code type}.
	 */
	public static <E extends Enum<E>> UnaryOperator<Object> toEnum(Class<E> type) {
		return v -> {
			if (type.isInstance(v)) {
				return v;
			}
			return Enum.valueOf(type, v.toString().trim().toUpperCase(Locale.ROOT));
		};
	}

	public static Predicate<Object> isInstance(Class<?> type) {
		return type::isInstance;
	}
}
