package com.mainframe.fixedwidth.schema;

/**
 * One slot of a schema's layout: an owned column, an owned nested schema, or a named
 * reference to a schema declared elsewhere.
 */
public abstract class FieldEntry {

    /**
     * Identifier of the entry, unique within the declaring schema.
     */
    public abstract String getId();

    /**
     * Key the entry's parsed value is stored under, or null when it contributes no value.
     */
    public abstract String getOutputKey();
}
