package com.mainframe.fixedwidth.option;

import lombok.NonNull;
import lombok.Value;

/**
 * Conflict rules for {@link Options#merge(Options, MergePolicy)}.
 */
@Value
public class MergePolicy {

	/**
	 * Keep the receiver's explicit values; only fill options it never set.
	 */
	public static final MergePolicy FILL_MISSING = new MergePolicy(Prefer.SELF, Missing.UNDEFINED);

	/**
	 * Adopt every inheritable value of the other table.
	 */
	public static final MergePolicy OVERWRITE = new MergePolicy(Prefer.OTHER, Missing.UNDEFINED);

	@NonNull
	Prefer prefer;

	@NonNull
	Missing missing;

	public enum Prefer {
		SELF,
		OTHER
	}

	/**
	 * Which receiver values count as missing.
	 */
	public enum Missing {
		/** Never explicitly set; defaults do not count as values. */
		UNDEFINED,
		/** Never explicitly set, or explicitly set to null. */
		NULL
	}
}
