package com.mainframe.fixedwidth.option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-owner-type table of recognized options, plus which of them are required at construction
 * and which may be read or written afterwards.
 *
 * Instances are immutable and are meant to be held in a {@code static final} constant of the
 * owning type.
 */
public final class OptionDefinitions {

	private final Map<String, OptionSpec> specs;
	private final Set<String> required;
	private final Set<String> readers;
	private final Set<String> writers;

	private OptionDefinitions(Builder builder) {
		this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.specs));
		this.required = Set.copyOf(builder.required);
		this.readers = Set.copyOf(builder.readers);
		this.writers = Set.copyOf(builder.writers);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<OptionSpec> find(String name) {
		return Optional.ofNullable(specs.get(name));
	}

	public boolean defines(String name) {
		return specs.containsKey(name);
	}

	public Set<String> names() {
		return specs.keySet();
	}

	public boolean isRequired(String name) {
		return required.contains(name);
	}

	public Set<String> getRequired() {
		return required;
	}

	public boolean isReadable(String name) {
		return readers.contains(name);
	}

	public boolean isWritable(String name) {
		return writers.contains(name);
	}

	public static final class Builder {
		private final Map<String, OptionSpec> specs = new LinkedHashMap<>();
		private final Set<String> required = new LinkedHashSet<>();
		private final Set<String> readers = new LinkedHashSet<>();
		private final Set<String> writers = new LinkedHashSet<>();

		private Builder() {
		}

		public Builder define(OptionSpec spec) {
			if (specs.putIfAbsent(spec.getName(), spec) != null) {
				throw new IllegalArgumentException("Option already defined: " + spec.getName());
			}
			return this;
		}

		public Builder required(String... names) {
			return addAll(required, names);
		}

		public Builder readers(String... names) {
			return addAll(readers, names);
		}

		public Builder writers(String... names) {
			return addAll(writers, names);
		}

		private Builder addAll(Set<String> target, String... names) {
			for (String name : names) {
				if (!specs.containsKey(name)) {
					throw new IllegalArgumentException("Option not defined: " + name);
				}
				target.add(name);
			}
			return this;
		}

		public OptionDefinitions build() {
			return new OptionDefinitions(this);
		}
	}
}
