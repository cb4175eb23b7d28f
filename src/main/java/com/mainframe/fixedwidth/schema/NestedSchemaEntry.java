package com.mainframe.fixedwidth.schema;

import lombok.Getter;
import lombok.NonNull;

/**
 * A child schema declared inline; its parent is the declaring schema.
 */
@Getter
public class NestedSchemaEntry extends FieldEntry {

    private final Schema schema;

    public NestedSchemaEntry(@NonNull Schema schema) {
        this.schema = schema;
    }

    @Override
    public String getId() {
        return schema.getName();
    }

    @Override
    public String getOutputKey() {
        return schema.getName();
    }

    @Override
    public String toString() {
        return "Schema[" + schema.getName() + "]";
    }
}
