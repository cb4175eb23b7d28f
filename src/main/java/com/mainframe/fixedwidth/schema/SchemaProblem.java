package com.mainframe.fixedwidth.schema;

import lombok.NonNull;
import lombok.Value;

/**
 * One problem found by {@link Schema#validate()}.
 */
@Value
public class SchemaProblem {

    /**
     * Dotted path of the schema that declares the offending field, e.g. {@code HEADER.totals}.
     */
    @NonNull
    String schemaPath;

    /**
     * Offending field, or null when the problem concerns the schema itself.
     */
    String field;

    @NonNull
    String message;

    @Override
    public String toString() {
        return (field == null ? schemaPath : schemaPath + "." + field) + ": " + message;
    }
}
