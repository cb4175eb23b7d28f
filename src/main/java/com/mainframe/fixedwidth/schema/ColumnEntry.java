package com.mainframe.fixedwidth.schema;

import com.mainframe.fixedwidth.column.Column;

import lombok.Getter;
import lombok.NonNull;

/**
 * A column owned by its schema. Grouped columns are identified as {@code group.name} and
 * stored under their group.
 */
@Getter
public class ColumnEntry extends FieldEntry {

    private final Column column;

    public ColumnEntry(@NonNull Column column) {
        this.column = column;
    }

    public static String idOf(String group, String name) {
        return group == null ? name : group + "." + name;
    }

    @Override
    public String getId() {
        return idOf(column.getGroup(), column.getName());
    }

    @Override
    public String getOutputKey() {
        if (column.isSpacer()) {
            return null;
        }
        return column.getGroup() != null ? column.getGroup() : column.getName();
    }

    public boolean isSpacer() {
        return column.isSpacer();
    }

    @Override
    public String toString() {
        return column.toString();
    }
}
