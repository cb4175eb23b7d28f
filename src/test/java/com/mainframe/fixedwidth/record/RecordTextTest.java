package com.mainframe.fixedwidth.record;

import com.mainframe.fixedwidth.column.Column;
import com.mainframe.fixedwidth.exception.SchemaException;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RecordTextTest {

    @Test
    void testFlattenJoinsNestedKeysWithDots() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", "DEAD");
        payload.put("note", null);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", "A1");
        record.put("payload", payload);

        assertThat(RecordText.flatten(record)).containsExactly("id=A1", "payload.code=DEAD", "payload.note=");
    }

    @Test
    void testUnflattenBuildsNestedRecords() {
        Map<String, Object> record = RecordText.unflatten(List.of("id=A1", "payload.code=DE AD", "payload.extra=x=y"));

        assertThat(record).containsEntry("id", "A1");
        assertThat(record.get("payload")).isEqualTo(Map.of("code", "DE AD", "extra", "x=y"));
    }

    @Test
    void testUnflattenKeepsValuesUntrimmed() {
        assertThat(RecordText.unflatten(List.of(" id = A1 "))).containsEntry("id", " A1 ");
    }

    @Test
    void testBlankDecimalSurvivesTextRoundTrip() {
        Schema record = new Definition().schema("RECORD", s -> {
            s.column("id", 2);
            s.column("amount", 5, Map.of(Column.TYPE, "decimal", Column.SCALE, 2));
        });

        List<String> lines = RecordText.flatten(record.parse("A1     "));

        assertThat(lines).containsExactly("id=A1", "amount=");
        assertThat(record.format(RecordText.unflatten(lines))).isEqualTo("A1     ");
    }

    @Test
    void testUnflattenRejectsMalformedLines() {
        assertThatThrownBy(() -> RecordText.unflatten(List.of("no equals sign")))
                .isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> RecordText.unflatten(List.of("=value")))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void testUnflattenRejectsValueAndRecordUnderSameKey() {
        assertThatThrownBy(() -> RecordText.unflatten(List.of("payload=x", "payload.code=y")))
                .isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> RecordText.unflatten(List.of("payload.code=y", "payload=x")))
                .isInstanceOf(SchemaException.class);
    }
}
