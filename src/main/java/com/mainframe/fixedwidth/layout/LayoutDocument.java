package com.mainframe.fixedwidth.layout;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.exception.FixedWidthException;
import com.mainframe.fixedwidth.exception.LayoutParseException;
import com.mainframe.fixedwidth.schema.Definition;
import com.mainframe.fixedwidth.schema.Schema;

import lombok.Getter;

/**
 * Parsed layout file: definition defaults plus top-level schema blocks.
 */
@Getter
public class LayoutDocument {
    private static final Logger log = LoggerFactory.getLogger(LayoutDocument.class);

    private final Map<String, String> options;

    /**
     * Line of the last {@code options} statement, 0 when there is none.
     */
    private final int optionsLine;

    private final List<LayoutStatement> schemas;

    public LayoutDocument(Map<String, String> options, int optionsLine, List<LayoutStatement> schemas) {
        this.options = Map.copyOf(options);
        this.optionsLine = optionsLine;
        this.schemas = List.copyOf(schemas);
    }

    /**
     * Declares every schema of this document in a new {@link Definition}. Declaration errors are
     * reported as {@link LayoutParseException}s carrying the offending line.
     */
    public Definition toDefinition(String name) {
        Definition definition;
        try {
            definition = new Definition(name, options);
        } catch (FixedWidthException e) {
            throw new LayoutParseException(optionsLine, e.getMessage(), e);
        }

        for (LayoutStatement statement : schemas) {
            declare(statement, () -> definition.schema(statement.argument(0), statement.getOptions(),
                    s -> declareFields(s, statement.getChildren())));
        }
        log.debug("Declared {} schema(s) from layout", definition.getSchemas().size());
        return definition;
    }

    private void declareFields(Schema schema, List<LayoutStatement> statements) {
        for (LayoutStatement statement : statements) {
            declare(statement, () -> declareField(schema, statement));
        }
    }

    private void declareField(Schema schema, LayoutStatement statement) {
        switch (statement.getKeyword()) {
        case LayoutParser.COLUMN -> schema.column(statement.argument(0),
                parseLength(statement, statement.argument(1)), statement.getOptions());
        case LayoutParser.SPACER -> {
            String pad = statement.argument(1);
            if (pad != null && pad.length() != 1) {
                throw new LayoutParseException(statement.getLine(), "Spacer padding must be one character, got '" + pad + "'");
            }
            schema.spacer(parseLength(statement, statement.argument(0)), pad == null ? null : pad.charAt(0));
        }
        case LayoutParser.SCHEMA -> schema.schema(statement.argument(0), statement.getOptions(),
                s -> declareFields(s, statement.getChildren()));
        case LayoutParser.REF -> {
            String store = statement.argument(0);
            String target = statement.argument(1) != null ? statement.argument(1) : store;
            schema.reference(store, target, statement.getOptions());
        }
        default -> throw new LayoutParseException(statement.getLine(), "Unexpected '" + statement.getKeyword() + "'");
        }
    }

    private static int parseLength(LayoutStatement statement, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new LayoutParseException(statement.getLine(), "Length must be a whole number, got '" + text + "'", e);
        }
    }

    private static void declare(LayoutStatement statement, Runnable declaration) {
        try {
            declaration.run();
        } catch (LayoutParseException e) {
            throw e;
        } catch (FixedWidthException e) {
            throw new LayoutParseException(statement.getLine(), e.getMessage(), e);
        }
    }
}
