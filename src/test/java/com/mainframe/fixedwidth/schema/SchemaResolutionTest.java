package com.mainframe.fixedwidth.schema;

import com.mainframe.fixedwidth.column.Alignment;
import com.mainframe.fixedwidth.column.Column;
import com.mainframe.fixedwidth.exception.DuplicateNameException;
import com.mainframe.fixedwidth.exception.SchemaException;
import com.mainframe.fixedwidth.exception.SchemaValidationException;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for lazily bound references and the option propagation that follows binding.
 */
class SchemaResolutionTest {

    private final Definition definition = new Definition();

    @Test
    void testReferenceParsesUnderStoreName() {
        definition.schema("INNER", s -> s.column("code", 4));
        Schema outer = definition.schema("OUTER", s -> {
            s.column("id", 2);
            s.reference("payload", "INNER");
        });

        Map<String, Object> parsed = outer.parse("A1DEAD");

        assertThat(outer.length()).isEqualTo(6);
        assertThat(parsed).containsEntry("id", "A1").containsEntry("payload", Map.of("code", "DEAD"));
        assertThat(outer.format(parsed)).isEqualTo("A1DEAD");
    }

    @Test
    void testOuterWithSingleReferenceToSibling() {
        definition.schema("Inner", s -> {
            s.column("kind", 1);
            s.column("code", 4);
        });
        Schema outer = definition.schema("Outer", s -> s.reference("payload", "Inner"));

        assertThat(outer.length()).isEqualTo(5);
        assertThat(outer.parse("XBEEF")).containsOnlyKeys("payload")
                .containsEntry("payload", Map.of("kind", "X", "code", "BEEF"));
    }

    @Test
    void testForwardReferenceResolvesOnFirstUse() {
        Schema outer = definition.schema("OUTER", s -> s.reference("INNER"));
        ReferenceEntry ref = outer.getReferences().get(0);
        assertThat(ref.getState()).isEqualTo(ResolutionState.UNRESOLVED);

        definition.schema("INNER", s -> s.column("code", 3));

        assertThat(outer.parse("abc")).containsEntry("INNER", Map.of("code", "abc"));
        assertThat(ref.getState()).isEqualTo(ResolutionState.RESOLVED);
    }

    @Test
    void testResolutionIsMemoized() {
        Schema inner = definition.schema("INNER", s -> s.column("code", 3));
        Schema outer = definition.schema("OUTER", s -> s.reference("payload", "INNER"));

        FieldEntry first = outer.lookup("payload");
        FieldEntry second = outer.lookup("payload");

        assertThat(first).isSameAs(second);
        assertThat(((ReferenceEntry) first).getTarget()).isSameAs(inner);
        assertThat(outer.lookupSchema("payload")).isSameAs(inner);
    }

    @Test
    void testNestedSchemaVisibleFromSiblingScope() {
        Schema outer = definition.schema("OUTER", s -> {
            s.schema("address", a -> a.column("city", 5));
            s.schema("billing", b -> b.reference("addr", "address"));
        });

        Map<String, Object> parsed = outer.parse("Paris Lyon");

        assertThat(outer.length()).isEqualTo(10);
        assertThat(parsed).containsEntry("address", Map.of("city", "Paris"));
        assertThat(parsed).containsEntry("billing", Map.of("addr", Map.of("city", "Lyon")));
    }

    @Test
    void testUnresolvableReferenceReportedAndThrown() {
        Schema outer = definition.schema("OUTER", s -> {
            s.column("id", 2);
            s.reference("payload", "MISSING");
        });

        List<SchemaProblem> problems = outer.validate();

        assertThat(problems).hasSize(1);
        assertThat(problems.get(0).getSchemaPath()).isEqualTo("OUTER");
        assertThat(problems.get(0).getField()).isEqualTo("payload");
        assertThat(problems.get(0).getMessage()).contains("MISSING");
        assertThat(outer.isValid()).isFalse();
        assertThatThrownBy(() -> outer.parse("A1")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> outer.match("A1")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(outer::requireValid)
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("OUTER.payload");
        assertThat(outer.getReferences().get(0).getState()).isEqualTo(ResolutionState.FAILED);
    }

    @Test
    void testFailedReferenceRetriedAfterTargetDeclared() {
        Schema outer = definition.schema("OUTER", s -> s.reference("MISSING"));
        assertThat(outer.isValid()).isFalse();

        definition.schema("MISSING", s -> s.column("x", 1));

        assertThat(outer.isValid()).isTrue();
        assertThat(outer.length()).isEqualTo(1);
    }

    @Test
    void testReferencingSchemaOptionsFillGapsInTarget() {
        definition.schema("INNER", Map.of(Schema.OPTIONAL, true), s -> {
            s.column("code", 4);
            s.column("tail", 2, Map.of(Column.ALIGN, "right"));
        });
        Schema outer = definition.schema("OUTER", Map.of(Column.ALIGN, "left", Schema.OPTIONAL, false),
                s -> s.reference("payload", "INNER"));

        Schema inner = outer.lookupSchema("payload");

        assertThat(inner.isOptional()).isTrue();
        assertThat(inner.getColumns().get(0).getAlignment()).isEqualTo(Alignment.LEFT);
        assertThat(inner.getColumns().get(1).getAlignment()).isEqualTo(Alignment.RIGHT);
    }

    @Test
    void testCarriedOptionsReachTargetColumns() {
        definition.schema("AMOUNT", s -> s.column("value", 5, Map.of(Column.TYPE, "integer")));
        Schema outer = definition.schema("OUTER", s -> s.reference("total", "AMOUNT", Map.of(Column.PADDING, "0")));

        assertThat(outer.format(Map.of("total", Map.of("value", 42)))).isEqualTo("00042");
        assertThat(outer.parse("00000")).containsEntry("total", Map.of("value", 0L));
    }

    @Test
    void testSharedTargetOnlyGetsGapsFilledByLaterReferences() {
        Schema shared = definition.schema("SHARED", s -> s.column("code", 4));
        Schema first = definition.schema("FIRST", Map.of(Column.ALIGN, "left"), s -> s.reference("SHARED"));
        Schema second = definition.schema("SECOND", Map.of(Column.ALIGN, "right", Column.PADDING, "*"),
                s -> s.reference("SHARED"));

        first.length();
        second.length();

        Column code = shared.getColumns().get(0);
        assertThat(code.getAlignment()).isEqualTo(Alignment.LEFT);
        assertThat(code.getPadding()).isEqualTo('*');
    }

    @Test
    void testOptionsQueuedOnUnresolvedReferencesAreAppliedOnce() {
        Schema inner = definition.schema("INNER", s -> s.column("code", 4));
        Schema middle = definition.schema("MIDDLE", s -> s.reference("INNER"));
        Schema outer = definition.schema("OUTER", Map.of(Column.PADDING, "#"), s -> s.reference("MIDDLE"));

        outer.lookup("MIDDLE");
        ReferenceEntry toInner = middle.getReferences().get(0);
        int queued = toInner.pendingCount();

        assertThat(toInner.isResolved()).isFalse();
        assertThat(queued).isPositive();

        Schema.propagate(middle, outer.getOptions());
        assertThat(toInner.pendingCount()).isEqualTo(queued);

        middle.lookup("INNER");
        assertThat(toInner.pendingCount()).isZero();
        assertThat(inner.getColumns().get(0).getPadding()).isEqualTo('#');
    }

    @Test
    void testDefinitionOptionsReachEveryDeclaredSchema() {
        Definition withDefaults = new Definition("defaults", Map.of(Column.ALIGN, "left"));
        Schema record = withDefaults.schema("RECORD", s -> s.column("id", 4));

        assertThat(record.format(Map.of("id", "A1"))).isEqualTo("A1  ");
    }

    @Test
    void testRecursiveLayoutDetected() {
        Schema loop = definition.schema("LOOP", s -> {
            s.column("id", 1);
            s.reference("next", "LOOP");
        });

        assertThat(loop.validate()).anySatisfy(p -> assertThat(p.getMessage()).contains("Recursive layout"));
        assertThatThrownBy(loop::length)
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Recursive layout");
    }

    @Test
    void testNestedSchemaNamedLikeReferenceTargetRejected() {
        Schema outer = definition.schema("OUTER", s -> s.reference("payload", "INNER"));

        assertThatThrownBy(() -> outer.schema("INNER", i -> i.column("x", 1)))
                .isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void testReferenceWithoutSchemaNameRejected() {
        Schema outer = definition.schema("OUTER", null);

        assertThatThrownBy(() -> outer.reference("payload", " "))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("missing a schema name");
        assertThat(outer.getFields()).isEmpty();
    }

    @Test
    void testLookupOfUnknownFieldOrColumnAsSchema() {
        Schema outer = definition.schema("OUTER", s -> s.column("id", 2));

        assertThatThrownBy(() -> outer.lookup("nope")).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> outer.lookupSchema("id"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("is a column");
    }
}
