package com.mainframe.fixedwidth.record;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mainframe.fixedwidth.exception.SchemaException;

import lombok.experimental.UtilityClass;

/**
 * Text form of records: one {@code dotted.key=value} line per value, nested records flattened
 * by joining keys with dots.
 *
 * Example: {@code {id=A1, payload={code=DEAD}}} is written as {@code id=A1} and
 * {@code payload.code=DEAD}.
 */
@UtilityClass
public class RecordText {

    public static List<String> flatten(Map<String, ?> record) {
        List<String> lines = new ArrayList<>();
        flatten("", record, lines);
        return lines;
    }

    private static void flatten(String prefix, Map<String, ?> record, List<String> lines) {
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> sub = (Map<String, ?>) nested;
                flatten(key + ".", sub, lines);
            } else {
                lines.add(key + "=" + (value == null ? "" : value));
            }
        }
    }

    /**
     * Rebuilds a nested record from {@code key=value} lines. Values are kept as text, untrimmed.
     *
     * @throws SchemaException on a line without {@code =}, or a key that is both a value and a
     *                         nested record
     */
    public static Map<String, Object> unflatten(List<String> lines) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (String line : lines) {
            int eq = line.indexOf('=');
            if (eq <= 0) {
                throw new SchemaException("Expected 'key=value', got: " + line);
            }
            String[] path = line.substring(0, eq).trim().split("\\.");
            put(record, path, line.substring(eq + 1));
        }
        return record;
    }

    @SuppressWarnings("unchecked")
    private static void put(Map<String, Object> record, String[] path, String value) {
        Map<String, Object> current = record;
        for (int i = 0; i < path.length - 1; i++) {
            Object next = current.computeIfAbsent(path[i], k -> new LinkedHashMap<String, Object>());
            if (!(next instanceof Map<?, ?>)) {
                throw new SchemaException("Key '" + String.join(".", path) + "' nests under the value '" + path[i] + "'");
            }
            current = (Map<String, Object>) next;
        }
        String leaf = path[path.length - 1];
        if (current.get(leaf) instanceof Map<?, ?>) {
            throw new SchemaException("Key '" + String.join(".", path) + "' is already a nested record");
        }
        current.put(leaf, value);
    }
}
