package com.mainframe.fixedwidth.option;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declaration of a single recognized option: how raw values are normalized, how they are
 * validated and what is read when the option was never set.
 */
@Value
@Builder
public class OptionSpec {

	@NonNull
	String name;

	/**
	 * Applied to non-null values before validation.
	 */
	@Builder.Default
	UnaryOperator<Object> transform = UnaryOperator.identity();

	/**
	 * Applied to non-null values after the transform.
	 */
	@Builder.Default
	Predicate<Object> validator = v -> true;

	/**
	 * Human readable description of what the validator accepts.
	 */
	@Builder.Default
	String expectation = "a valid value";

	Object defaultValue;

	/**
	 * Whether the option may be filled in from an enclosing or referencing context.
	 * Identity options (names, widths) are not.
	 */
	@Builder.Default
	boolean inheritable = true;
}
