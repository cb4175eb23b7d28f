package com.mainframe.fixedwidth.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.exception.DuplicateNameException;
import com.mainframe.fixedwidth.exception.SchemaException;
import com.mainframe.fixedwidth.exception.SchemaValidationException;
import com.mainframe.fixedwidth.option.Options;

/**
 * Root catalog of top-level schemas. Its options are the defaults every schema declared in it
 * starts from, and references that find nothing in their ancestor schemas end up here.
 */
public class Definition implements SchemaCatalog {
    private static final Logger log = LoggerFactory.getLogger(Definition.class);

    private final String name;
    private final Options options;
    private final List<Schema> schemas = new ArrayList<>();

    public Definition() {
        this("definition", Map.of());
    }

    /**
     * @param options defaults for all schemas: {@code optional}, {@code singular}, {@code align},
     *                {@code padding}, {@code truncate}
     */
    public Definition(String name, Map<String, ?> options) {
        this.name = name;
        this.options = new Options(Schema.INHERITABLE_DEFINITIONS, "definition '" + name + "'", options);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Options getOptions() {
        return options;
    }

    public Schema schema(String schemaName, Consumer<Schema> setup) {
        return schema(schemaName, Map.of(), setup);
    }

    /**
     * Declares a top-level schema. Its name must be unique in this definition.
     */
    public Schema schema(String schemaName, Map<String, ?> schemaOptions, Consumer<Schema> setup) {
        if (!lookupByName(schemaName).isEmpty()) {
            throw new DuplicateNameException("You have already defined a schema named '" + schemaName
                    + "' in '" + name + "'");
        }
        Map<String, Object> all = new LinkedHashMap<>();
        if (schemaOptions != null) {
            all.putAll(schemaOptions);
        }
        all.put(Schema.NAME, schemaName);

        Schema schema = new Schema(all, this);
        if (setup != null) {
            schema.setup(setup);
        }
        schemas.add(schema);
        log.debug("Definition '{}': added schema '{}'", name, schemaName);
        return schema;
    }

    @Override
    public List<Schema> lookupByName(String schemaName) {
        if (schemaName == null) {
            return List.of();
        }
        return schemas.stream()
                .filter(s -> schemaName.equals(s.getName()))
                .toList();
    }

    public List<Schema> getSchemas() {
        return Collections.unmodifiableList(schemas);
    }

    /**
     * First schema, in declaration order, whose {@link Schema#match(String)} accepts the line.
     */
    public Optional<Schema> findMatching(String line) {
        for (Schema schema : schemas) {
            if (schema.match(line)) {
                return Optional.of(schema);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses the line with the first matching schema.
     *
     * @throws SchemaException if no schema matches
     */
    public Map<String, Object> parseLine(String line) {
        Schema schema = findMatching(line)
                .orElseThrow(() -> new SchemaException("No schema in '" + name + "' matches line: " + line));
        log.debug("Line matched schema '{}'", schema.getName());
        return schema.parse(line);
    }

    public List<SchemaProblem> validate() {
        Set<SchemaProblem> problems = new LinkedHashSet<>();
        for (Schema schema : schemas) {
            problems.addAll(schema.validate());
        }
        return List.copyOf(problems);
    }

    /**
     * Validates every schema and settles their lengths, so that parsing, formatting and matching
     * afterwards read only.
     *
     * @throws SchemaValidationException carrying every problem {@link #validate()} reports
     */
    public Definition requireValid() {
        List<SchemaProblem> problems = validate();
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(problems);
        }
        schemas.forEach(Schema::length);
        return this;
    }
}
