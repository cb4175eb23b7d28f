package com.mainframe.fixedwidth.column;

/**
 * Parses and formats a single fixed-width value.
 *
 * Implementations must be total: {@link #parse(String)} accepts any text up to
 * {@link #getLength()} characters and {@link #format(Object)} always returns exactly
 * {@link #getLength()} characters (or fails with a
 * {@link com.mainframe.fixedwidth.exception.FieldFormatException}).
 */
public interface FieldCodec {

    String getName();

    /**
     * Width in characters (unicode code points).
     */
    int getLength();

    /**
     * Grouping label, or null for the default group.
     */
    String getGroup();

    Object parse(String raw);

    String format(Object value);
}
