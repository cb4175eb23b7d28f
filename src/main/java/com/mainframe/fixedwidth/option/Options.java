package com.mainframe.fixedwidth.option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.mainframe.fixedwidth.exception.ConfigException;

/**
 * A validated option table. Values that were explicitly set are kept apart from defaults so
 * that merging can tell a deliberate setting from an unset one.
 */
public final class Options {

	private final OptionDefinitions definitions;
	private final String owner;
	private final Map<String, Object> values = new LinkedHashMap<>();

	/**
	 * @param definitions the recognized options
	 * @param owner       label used in error messages, e.g. {@code "column 'id'"}
	 * @param initial     explicitly provided values
	 * @throws ConfigException if an option is unknown, invalid, or a required option is missing
	 */
	public Options(OptionDefinitions definitions, String owner, Map<String, ?> initial) {
		this.definitions = Objects.requireNonNull(definitions, "definitions");
		this.owner = owner;
		if (initial != null) {
			initial.forEach((name, value) -> store(name, value));
		}
		for (String name : definitions.getRequired()) {
			if (values.get(name) == null) {
				throw new ConfigException("Missing required option '" + name + "' for " + owner);
			}
		}
	}

	public OptionDefinitions getDefinitions() {
		return definitions;
	}

	/**
	 * Returns the explicit value, or the option's default when it was never set.
	 */
	public Object get(String name) {
		OptionSpec spec = spec(name);
		return values.containsKey(name) ? values.get(name) : spec.getDefaultValue();
	}

	public <T> T get(String name, Class<T> type) {
		Object value = get(name);
		if (value == null) {
			return null;
		}
		if (!type.isInstance(value)) {
			throw new ConfigException("Option '" + name + "' of " + owner + " is a "
					+ value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
		}
		return type.cast(value);
	}

	public boolean getBoolean(String name) {
		return Boolean.TRUE.equals(get(name, Boolean.class));
	}

	/**
	 * True when the option was explicitly set, even to null.
	 */
	public boolean has(String name) {
		spec(name);
		return values.containsKey(name);
	}

	public boolean defines(String name) {
		return definitions.defines(name);
	}

	public void set(String name, Object value) {
		set(name, value, true);
	}

	/**
	 * @return whether the value was stored
	 */
	public boolean set(String name, Object value, boolean overwrite) {
		if (!overwrite && values.containsKey(name)) {
			return false;
		}
		if (value == null && definitions.isRequired(name)) {
			throw new ConfigException("Option '" + name + "' of " + owner + " is required and cannot be null");
		}
		store(name, value);
		return true;
	}

	/**
	 * Merges the explicit values of {@code other} into this table. Only options this table defines
	 * and marks inheritable are considered.
	 */
	public Options merge(Options other, MergePolicy policy) {
		if (other == null || other == this) {
			return this;
		}
		return merge(other.values, policy);
	}

	public Options merge(Map<String, ?> other, MergePolicy policy) {
		Objects.requireNonNull(policy, "policy");
		if (other == null) {
			return this;
		}
		for (Map.Entry<String, ?> entry : other.entrySet()) {
			String name = entry.getKey();
			OptionSpec spec = definitions.find(name).orElse(null);
			if (spec == null || !spec.isInheritable()) {
				continue;
			}
			if (isMissing(name, policy.getMissing()) || policy.getPrefer() == MergePolicy.Prefer.OTHER) {
				store(name, entry.getValue());
			}
		}
		return this;
	}

	/**
	 * Explicitly set values, in insertion order.
	 */
	public Map<String, Object> explicitValues() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	private boolean isMissing(String name, MergePolicy.Missing missing) {
		if (!values.containsKey(name)) {
			return true;
		}
		return missing == MergePolicy.Missing.NULL && values.get(name) == null;
	}

	private void store(String name, Object raw) {
		OptionSpec spec = spec(name);
		Object value = raw;
		if (value != null) {
			try {
				value = spec.getTransform().apply(value);
			} catch (RuntimeException e) {
				throw new ConfigException("Invalid value for option '" + name + "' of " + owner
						+ ": expected " + spec.getExpectation() + ", got '" + raw + "'", e);
			}
			if (value == null || !spec.getValidator().test(value)) {
				throw new ConfigException("Invalid value for option '" + name + "' of " + owner
						+ ": expected " + spec.getExpectation() + ", got '" + raw + "'");
			}
		}
		values.put(name, value);
	}

	private OptionSpec spec(String name) {
		return definitions.find(name)
				.orElseThrow(() -> new ConfigException("Unknown option '" + name + "' for " + owner));
	}

	@Override
	public String toString() {
		return owner + " " + values;
	}
}
