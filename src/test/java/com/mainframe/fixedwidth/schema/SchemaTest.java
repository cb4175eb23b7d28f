package com.mainframe.fixedwidth.schema;

import com.mainframe.fixedwidth.column.Alignment;
import com.mainframe.fixedwidth.column.Column;
import com.mainframe.fixedwidth.exception.ConfigException;
import com.mainframe.fixedwidth.exception.DuplicateNameException;
import com.mainframe.fixedwidth.exception.SchemaException;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for declaring, parsing and formatting a single schema.
 */
class SchemaTest {

    private final Definition definition = new Definition();

    @Test
    void testParseAndFormatFlatRecord() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 2);
            s.spacer(2);
            s.column("code", 4);
        });

        assertThat(record.length()).isEqualTo(8);
        assertThat(record.parse("A1  DEAD")).containsExactly(entry("id", "A1"), entry("code", "DEAD"));
        assertThat(record.format(Map.of("id", "A1", "code", "DEAD"))).isEqualTo("A1  DEAD");
    }

    @Test
    void testRightAlignedColumnKeepsTrailingSpaces() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 3);
            s.spacer(1);
            s.column("code", 4);
        });

        Map<String, Object> parsed = record.parse("A1  DEAD");

        assertThat(record.length()).isEqualTo(8);
        assertThat(parsed).containsExactly(entry("id", "A1 "), entry("code", "DEAD"));
        assertThat(record.format(parsed)).isEqualTo("A1  DEAD");
    }

    @Test
    void testShortLineReadsMissingCharactersAsEmpty() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 2);
            s.column("code", 4);
        });

        assertThat(record.parse("A1")).containsEntry("id", "A1").containsEntry("code", "");
    }

    @Test
    void testParseFromOffset() {
        Schema record = definition.schema("RECORD", s -> s.column("code", 4, Map.of(Column.ALIGN, "left")));

        assertThat(record.parse("XXDEAD", 2)).containsEntry("code", "DEAD");
    }

    @Test
    void testParseRejectsNegativeStart() {
        Schema record = definition.schema("RECORD", s -> s.column("code", 2));

        assertThatThrownBy(() -> record.parse("AB", -1))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("negative position -1");
    }

    @Test
    void testSchemaOptionChangeReachesOnlyLaterColumns() {
        Schema record = definition.schema("RECORD", s -> s.column("before", 2));

        record.setOption(Schema.OPTIONAL, true);
        record.column("after", 2);

        assertThat(record.getColumns()).extracting(Column::isOptional).containsExactly(false, true);
    }

    @Test
    void testFormatMissingValuesAsPadding() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 2);
            s.column("code", 4, Map.of(Column.PADDING, '.'));
        });

        assertThat(record.format(Map.of("id", "A1"))).isEqualTo("A1....");
        assertThat(record.format(null)).isEqualTo("  ....");
    }

    @Test
    void testSpacersGetUniqueNames() {
        Schema record = definition.schema("RECORD", s -> {
            s.spacer(1);
            s.column("id", 2);
            s.spacer(3, '-');
        });

        assertThat(record.getFields()).containsExactly("spacer_1", "id", "spacer_2");
        assertThat(record.format(Map.of("id", "A1"))).isEqualTo(" A1---");
        assertThat(record.parse(" A1---")).containsOnlyKeys("id");
    }

    @Test
    void testGroupedColumnsNestUnderGroup() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 2);
            s.column("first", 3, Map.of(Column.GROUP, "name", Column.ALIGN, "left"));
            s.column("last", 3, Map.of(Column.GROUP, "name", Column.ALIGN, "left"));
        });

        Map<String, Object> parsed = record.parse("A1BobLee");

        assertThat(record.getFields()).containsExactly("id", "name.first", "name.last");
        assertThat(parsed).containsEntry("name", Map.of("first", "Bob", "last", "Lee"));
        assertThat(record.format(parsed)).isEqualTo("A1BobLee");
    }

    @Test
    void testSameColumnNameAllowedInDifferentGroups() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("code", 2, Map.of(Column.GROUP, "from"));
            s.column("code", 2, Map.of(Column.GROUP, "to"));
        });

        assertThat(record.parse("AABB")).containsEntry("from", Map.of("code", "AA")).containsEntry("to", Map.of("code", "BB"));
    }

    @Test
    void testDuplicateColumnRejected() {
        Schema record = definition.schema("RECORD", s -> s.column("id", 2));

        assertThatThrownBy(() -> record.column("id", 3))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("'id'");
    }

    @Test
    void testGroupClashingWithColumnRejected() {
        Schema record = definition.schema("RECORD", s -> s.column("name", 2));

        assertThatThrownBy(() -> record.column("first", 3, Map.of(Column.GROUP, "name")))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("group");
    }

    @Test
    void testNestedSchemaClashingWithColumnRejected() {
        Schema record = definition.schema("RECORD", s -> s.column("totals", 2));

        assertThatThrownBy(() -> record.schema("totals", t -> t.column("sum", 4)))
                .isInstanceOf(DuplicateNameException.class);
        assertThat(record.getFields()).containsExactly("totals");
    }

    @Test
    void testReservedNamesRejected() {
        Schema record = definition.schema("RECORD", null);

        assertThatThrownBy(() -> record.column("spacer_9", 2)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> record.column("Repeats", 2)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> record.column("x", 2, Map.of(Column.GROUP, "spacers")))
                .isInstanceOf(ConfigException.class);
        assertThat(record.getFields()).isEmpty();
    }

    @Test
    void testNestedSchemaParsesIntoSubRecord() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("id", 2);
            s.schema("totals", t -> {
                t.column("count", 2);
                t.column("sum", 3);
            });
        });

        Map<String, Object> parsed = record.parse("A1 7 42");

        assertThat(record.length()).isEqualTo(7);
        assertThat(parsed).containsEntry("totals", Map.of("count", "7", "sum", "42"));
        assertThat(record.lookupSchema("totals").getPath()).isEqualTo("RECORD.totals");
    }

    @Test
    void testFormatRejectsScalarForNestedRecord() {
        Schema record = definition.schema("RECORD", s -> s.schema("totals", t -> t.column("sum", 3)));

        assertThatThrownBy(() -> record.format(Map.of("totals", "oops")))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("nested record");
    }

    @Test
    void testLengthRecomputedAfterNewField() {
        Schema record = definition.schema("RECORD", s -> s.column("id", 2));
        assertThat(record.length()).isEqualTo(2);

        record.column("code", 4);

        assertThat(record.length()).isEqualTo(6);
    }

    @Test
    void testMatchChecksWidthAndTrap() {
        Schema header = definition.schema("HEADER", Map.of(Schema.TRAP, "H"), s -> {
            s.column("kind", 1);
            s.column("date", 8);
        });

        assertThat(header.match("H20240131")).isTrue();
        assertThat(header.match("H20240131   ")).isTrue();
        assertThat(header.match("D20240131")).isFalse();
        assertThat(header.match("H202401311")).isFalse();
        assertThat(header.match(null)).isFalse();
    }

    @Test
    void testSchemaOptionsFlowIntoColumns() {
        Schema record = definition.schema("RECORD", Map.of(Column.ALIGN, "left", Column.PADDING, "_"), s -> {
            s.column("id", 4);
            s.column("code", 4, Map.of(Column.ALIGN, "right"));
        });

        assertThat(record.getColumns().get(0).getAlignment()).isEqualTo(Alignment.LEFT);
        assertThat(record.getColumns().get(1).getAlignment()).isEqualTo(Alignment.RIGHT);
        assertThat(record.format(Map.of("id", "A", "code", "B"))).isEqualTo("A______B");
    }

    @Test
    void testSetupCannotBeReentered() {
        Schema record = definition.schema("RECORD", null);

        assertThatThrownBy(() -> record.setup(s -> s.setup(inner -> inner.column("id", 2))))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("already in setup");
        assertThatThrownBy(() -> record.setup(null)).isInstanceOf(SchemaException.class);
    }

    @Test
    void testNullParentRejected() {
        assertThatThrownBy(() -> new Schema("ORPHAN", null))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("parent");
    }

    @Test
    void testParseRejectsNullLine() {
        Schema record = definition.schema("RECORD", s -> s.column("id", 2));

        assertThatThrownBy(() -> record.parse(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testOptionAccess() {
        Schema record = definition.schema("RECORD", null);

        record.setOption(Schema.SINGULAR, "yes");

        assertThat(record.isSingular()).isTrue();
        assertThat(record.getOption(Schema.NAME)).isEqualTo("RECORD");
        assertThatThrownBy(() -> record.setOption(Schema.NAME, "OTHER")).isInstanceOf(ConfigException.class);
    }

    @Test
    void testParsedRecordKeepsLayoutOrder() {
        Schema record = definition.schema("RECORD", s -> {
            s.column("z", 1);
            s.column("a", 1);
            s.column("m", 1);
        });

        Map<String, Object> parsed = record.parse("123");

        assertThat(List.copyOf(parsed.keySet())).containsExactly("z", "a", "m");
        assertThat(record.format(new LinkedHashMap<>(parsed))).isEqualTo("123");
    }
}
