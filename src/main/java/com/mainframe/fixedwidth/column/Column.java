package com.mainframe.fixedwidth.column;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.exception.ConfigException;
import com.mainframe.fixedwidth.exception.FieldFormatException;
import com.mainframe.fixedwidth.option.OptionDefinitions;
import com.mainframe.fixedwidth.option.OptionRules;
import com.mainframe.fixedwidth.option.OptionSpec;
import com.mainframe.fixedwidth.option.Options;

/**
 * Default {@link FieldCodec}: strips and applies padding according to the alignment, and
 * coerces values by {@link ColumnType} or by a custom parser/formatter pair.
 *
 * All behavior is read from the column's {@link Options} on every call, so values filled in
 * later by option propagation take effect.
 */
public class Column implements FieldCodec {
    private static final Logger log = LoggerFactory.getLogger(Column.class);

    public static final String NAME = "name";
    public static final String LENGTH = "length";
    public static final String ALIGN = "align";
    public static final String PADDING = "padding";
    public static final String TRUNCATE = "truncate";
    public static final String OPTIONAL = "optional";
    public static final String GROUP = "group";
    public static final String TYPE = "type";
    public static final String SCALE = "scale";
    public static final String PATTERN = "pattern";
    public static final String PARSER = "parser";
    public static final String FORMATTER = "formatter";

    public static final String DEFAULT_DATE_PATTERN = "yyyyMMdd";

    public static final OptionDefinitions DEFINITIONS = OptionDefinitions.builder()
            .define(OptionSpec.builder().name(NAME)
                    .transform(OptionRules.TRIMMED).validator(OptionRules.IS_IDENTIFIER)
                    .expectation("an identifier").inheritable(false).build())
            .define(OptionSpec.builder().name(LENGTH)
                    .transform(OptionRules.TO_INTEGER).validator(OptionRules.IS_POSITIVE)
                    .expectation("a positive width").inheritable(false).build())
            .define(OptionSpec.builder().name(ALIGN)
                    .transform(OptionRules.toEnum(Alignment.class)).validator(OptionRules.isInstance(Alignment.class))
                    .expectation("LEFT or RIGHT").defaultValue(Alignment.RIGHT).build())
            .define(OptionSpec.builder().name(PADDING)
                    .transform(OptionRules.TO_CHARACTER).validator(OptionRules.IS_CHARACTER)
                    .expectation("a single character").defaultValue(' ').build())
            .define(OptionSpec.builder().name(TRUNCATE)
                    .transform(OptionRules.TO_BOOLEAN).validator(OptionRules.IS_BOOLEAN)
                    .expectation("true or false").defaultValue(false).build())
            .define(OptionSpec.builder().name(OPTIONAL)
                    .transform(OptionRules.TO_BOOLEAN).validator(OptionRules.IS_BOOLEAN)
                    .expectation("true or false").defaultValue(false).build())
            .define(OptionSpec.builder().name(GROUP)
                    .transform(OptionRules.TRIMMED).validator(OptionRules.IS_IDENTIFIER)
                    .expectation("an identifier").inheritable(false).build())
            .define(OptionSpec.builder().name(TYPE)
                    .transform(OptionRules.toEnum(ColumnType.class)).validator(OptionRules.isInstance(ColumnType.class))
                    .expectation("one of STRING, INTEGER, DECIMAL, DATE").defaultValue(ColumnType.STRING)
                    .inheritable(false).build())
            .define(OptionSpec.builder().name(SCALE)
                    .transform(OptionRules.TO_INTEGER).validator(OptionRules.IS_NON_NEGATIVE)
                    .expectation("a non-negative number of decimal places").defaultValue(0)
                    .inheritable(false).build())
            .define(OptionSpec.builder().name(PATTERN)
                    .transform(v -> v instanceof DateTimeFormatter ? v : DateTimeFormatter.ofPattern(v.toString()))
                    .validator(OptionRules.isInstance(DateTimeFormatter.class))
                    .expectation("a date pattern").defaultValue(DateTimeFormatter.ofPattern(DEFAULT_DATE_PATTERN))
                    .inheritable(false).build())
            .define(OptionSpec.builder().name(PARSER)
                    .validator(OptionRules.IS_FUNCTION).expectation("a Function<String, Object>")
                    .inheritable(false).build())
            .define(OptionSpec.builder().name(FORMATTER)
                    .validator(OptionRules.IS_FUNCTION).expectation("a Function<Object, String>")
                    .inheritable(false).build())
            .required(NAME, LENGTH)
            .readers(NAME, LENGTH, ALIGN, PADDING, TRUNCATE, OPTIONAL, GROUP, TYPE)
            .writers(ALIGN, PADDING, TRUNCATE, OPTIONAL)
            .build();

    private final Options options;
    private final boolean spacer;

    public Column(Map<String, ?> options) {
        this(options, false);
    }

    protected Column(Map<String, ?> options, boolean spacer) {
        this.options = new Options(DEFINITIONS, describe(options), options);
        this.spacer = spacer;
    }

    /**
     * A filler column: occupies width, contributes nothing to parsed records.
     */
    public static Column spacer(String name, int length, Character padding) {
        Map<String, Object> opts = new LinkedHashMap<>();
        opts.put(NAME, name);
        opts.put(LENGTH, length);
        if (padding != null) {
            opts.put(PADDING, padding);
        }
        return new Column(opts, true);
    }

    public Options getOptions() {
        return options;
    }

    public boolean isSpacer() {
        return spacer;
    }

    @Override
    public String getName() {
        return options.get(NAME, String.class);
    }

    @Override
    public int getLength() {
        return options.get(LENGTH, Integer.class);
    }

    @Override
    public String getGroup() {
        return options.get(GROUP, String.class);
    }

    public Alignment getAlignment() {
        return options.get(ALIGN, Alignment.class);
    }

    public char getPadding() {
        return options.get(PADDING, Character.class);
    }

    public boolean isTruncate() {
        return options.getBoolean(TRUNCATE);
    }

    public boolean isOptional() {
        return options.getBoolean(OPTIONAL);
    }

    public ColumnType getType() {
        return options.get(TYPE, ColumnType.class);
    }

    /**
     * Reads a readable option after construction.
     */
    public Object getOption(String name) {
        if (!DEFINITIONS.isReadable(name)) {
            throw new ConfigException(
                    "Option '" + name + "' of column '" + getName() + "' is not readable");
        }
        return options.get(name);
    }

    /**
     * Changes a writable option after construction.
     */
    public void setOption(String name, Object value) {
        if (!DEFINITIONS.isWritable(name)) {
            throw new ConfigException(
                    "Option '" + name + "' of column '" + getName() + "' is not writable");
        }
        options.set(name, value);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object parse(String raw) {
        if (spacer) {
            return null;
        }
        String value = raw == null ? "" : raw;
        if (isOptional() && isBlank(value)) {
            return null;
        }
        String stripped = strip(value);
        Function<String, Object> parser = options.get(PARSER, Function.class);
        try {
            if (parser != null) {
                return parser.apply(stripped);
            }
            ColumnType type = getType();
            if (type.isNumeric() && stripped.isEmpty() && !value.isEmpty() && getPadding() == '0') {
                stripped = "0";
            }
            return type.parse(stripped, options.get(SCALE, Integer.class), options.get(PATTERN, DateTimeFormatter.class));
        } catch (RuntimeException e) {
            log.debug("Column '{}' could not parse '{}'", getName(), value, e);
            throw new FieldFormatException("Column '" + getName() + "' cannot parse '" + value + "' as "
                    + getType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public String format(Object value) {
        int length = getLength();
        char padding = getPadding();
        if (spacer) {
            return String.valueOf(padding).repeat(length);
        }

        String text;
        Function<Object, String> formatter = options.get(FORMATTER, Function.class);
        try {
            if (formatter != null) {
                text = value == null ? "" : String.valueOf(formatter.apply(value));
            } else {
                text = getType().format(value, options.get(SCALE, Integer.class),
                        options.get(PATTERN, DateTimeFormatter.class));
            }
        } catch (RuntimeException e) {
            throw new FieldFormatException("Column '" + getName() + "' cannot format '" + value + "' as "
                    + getType() + ": " + e.getMessage(), e);
        }

        int width = text.codePointCount(0, text.length());
        if (width > length) {
            if (!isTruncate()) {
                throw new FieldFormatException("Column '" + getName() + "' is " + length
                        + " characters wide, but the formatted value '" + text + "' has " + width);
            }
            return text.substring(0, text.offsetByCodePoints(0, length));
        }

        String pad = String.valueOf(padding).repeat(length - width);
        return getAlignment() == Alignment.LEFT ? text + pad : pad + text;
    }

    private String strip(String value) {
        char padding = getPadding();
        if (getAlignment() == Alignment.LEFT) {
            int end = value.length();
            while (end > 0 && value.charAt(end - 1) == padding) {
                end--;
            }
            return value.substring(0, end);
        }
        int start = 0;
        while (start < value.length() && value.charAt(start) == padding) {
            start++;
        }
        return value.substring(start);
    }

    private boolean isBlank(String value) {
        char padding = getPadding();
        return value.chars().allMatch(c -> c == padding || Character.isWhitespace(c));
    }

    private static String describe(Map<String, ?> options) {
        Object name = options == null ? null : options.get(NAME);
        return "column '" + name + "'";
    }

    @Override
    public String toString() {
        return (spacer ? "Spacer" : "Column") + "[" + getName() + ", " + getLength() + "]";
    }
}
