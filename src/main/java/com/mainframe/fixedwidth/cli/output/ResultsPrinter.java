package com.mainframe.fixedwidth.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import com.mainframe.fixedwidth.column.Column;
import com.mainframe.fixedwidth.record.RecordText;
import com.mainframe.fixedwidth.schema.ColumnEntry;
import com.mainframe.fixedwidth.schema.FieldEntry;
import com.mainframe.fixedwidth.schema.NestedSchemaEntry;
import com.mainframe.fixedwidth.schema.ReferenceEntry;
import com.mainframe.fixedwidth.schema.Schema;
import com.mainframe.fixedwidth.schema.SchemaProblem;

/**
 * Responsible only for writing command results. No validation, no execution.
 */
public class ResultsPrinter {

    private final PrintWriter out;

    public ResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    /**
     * Writes the field map of a schema: character range, name and kind of each field. Nested
     * schemas are expanded; references show their target.
     */
    public void printLayout(Schema schema) {
        out.printf("%s (%d characters)%n", schema.getName(), schema.length());
        printFields(schema, 0, "  ");
        out.flush();
    }

    private int printFields(Schema schema, int offset, String indent) {
        int cursor = offset;
        for (String id : schema.getFields()) {
            FieldEntry entry = schema.lookup(id);
            if (entry instanceof ColumnEntry columnEntry) {
                Column column = columnEntry.getColumn();
                String kind = column.isSpacer() ? "spacer" : "column " + column.getType();
                printRange(indent, cursor, column.getLength(), id, kind);
                cursor += column.getLength();
            } else if (entry instanceof NestedSchemaEntry nested) {
                Schema child = nested.getSchema();
                printRange(indent, cursor, child.length(), id, "schema");
                cursor = printFields(child, cursor, indent + "  ");
            } else if (entry instanceof ReferenceEntry ref) {
                Schema target = ref.getTarget();
                printRange(indent, cursor, target.length(), id, "reference -> " + target.getPath());
                cursor += target.length();
            }
        }
        return cursor;
    }

    private void printRange(String indent, int start, int length, String id, String kind) {
        out.printf("%s[%d, %d)  %s  %s%n", indent, start, start + length, id, kind);
    }

    public void printProblems(List<SchemaProblem> problems) {
        if (problems.isEmpty()) {
            out.println("Layout is valid.");
        } else {
            out.printf("%d problem(s):%n", problems.size());
            problems.forEach(p -> out.println("  " + p));
        }
        out.flush();
    }

    /**
     * Writes a parsed record as {@code key=value} lines followed by a blank line.
     */
    public void printRecord(int lineNumber, Schema schema, Map<String, Object> record) {
        out.printf("# line %d: %s%n", lineNumber, schema.getName());
        RecordText.flatten(record).forEach(out::println);
        out.println();
        out.flush();
    }

    public void printLine(String line) {
        out.println(line);
        out.flush();
    }
}
