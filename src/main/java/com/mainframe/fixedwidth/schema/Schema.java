package com.mainframe.fixedwidth.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.column.Alignment;
import com.mainframe.fixedwidth.column.Column;
import com.mainframe.fixedwidth.exception.ConfigException;
import com.mainframe.fixedwidth.exception.DuplicateNameException;
import com.mainframe.fixedwidth.exception.SchemaException;
import com.mainframe.fixedwidth.exception.SchemaValidationException;
import com.mainframe.fixedwidth.option.MergePolicy;
import com.mainframe.fixedwidth.option.OptionDefinitions;
import com.mainframe.fixedwidth.option.OptionRules;
import com.mainframe.fixedwidth.option.OptionSpec;
import com.mainframe.fixedwidth.option.Options;
import com.mainframe.fixedwidth.util.CodePointUtil;

/**
 * An ordered, named layout of columns, nested schemas and references to other schemas.
 *
 * Declaration is append-only: {@link #column}, {@link #spacer}, {@link #schema} and
 * {@link #reference} add fields in layout order. References are bound lazily, on first use, by
 * walking up the parent chain; once bound, the referencing schema's options fill the gaps in
 * the target's options (and those of everything it owns).
 *
 * Not thread-safe while references are unresolved. Call {@link #requireValid()} before sharing a
 * schema between threads; {@link #parse}, {@link #format}, {@link #match} and {@link #length}
 * do not mutate anything after that.
 */
public class Schema implements SchemaScope {
    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    public static final String NAME = "name";
    public static final String OPTIONAL = "optional";
    public static final String SINGULAR = "singular";
    public static final String TRAP = "trap";

    /**
     * Field names starting with one of these are kept for generated fields.
     */
    public static final List<String> RESERVED_PREFIXES = List.of("spacer", "repeat");

    private static final OptionSpec OPTIONAL_SPEC = flag(OPTIONAL);
    private static final OptionSpec SINGULAR_SPEC = flag(SINGULAR);
    private static final OptionSpec ALIGN_SPEC = OptionSpec.builder().name(Column.ALIGN)
            .transform(OptionRules.toEnum(Alignment.class)).validator(OptionRules.isInstance(Alignment.class))
            .expectation("LEFT or RIGHT").build();
    private static final OptionSpec PADDING_SPEC = OptionSpec.builder().name(Column.PADDING)
            .transform(OptionRules.TO_CHARACTER).validator(OptionRules.IS_CHARACTER)
            .expectation("a single character").build();
    private static final OptionSpec TRUNCATE_SPEC = OptionSpec.builder().name(Column.TRUNCATE)
            .transform(OptionRules.TO_BOOLEAN).validator(OptionRules.IS_BOOLEAN)
            .expectation("true or false").build();

    public static final OptionDefinitions DEFINITIONS = OptionDefinitions.builder()
            .define(OptionSpec.builder().name(NAME)
                    .transform(OptionRules.TRIMMED).validator(OptionRules.IS_IDENTIFIER)
                    .expectation("an identifier").inheritable(false).build())
            .define(OPTIONAL_SPEC)
            .define(SINGULAR_SPEC)
            .define(OptionSpec.builder().name(TRAP)
                    .transform(OptionRules.TO_LINE_PREDICATE).validator(OptionRules.IS_PREDICATE)
                    .expectation("a line predicate or a regular expression").inheritable(false).build())
            .define(ALIGN_SPEC)
            .define(PADDING_SPEC)
            .define(TRUNCATE_SPEC)
            .required(NAME)
            .readers(NAME, OPTIONAL, SINGULAR)
            .writers(OPTIONAL, SINGULAR)
            .build();

    /**
     * Options that flow from a scope into the schemas and columns below it. Used for root
     * catalogs and for options carried by a reference.
     */
    public static final OptionDefinitions INHERITABLE_DEFINITIONS = OptionDefinitions.builder()
            .define(OPTIONAL_SPEC)
            .define(SINGULAR_SPEC)
            .define(ALIGN_SPEC)
            .define(PADDING_SPEC)
            .define(TRUNCATE_SPEC)
            .build();

    private enum OutputKind {
        COLUMN, GROUP, SCHEMA, REFERENCE
    }

    private final SchemaScope parent;
    private final Options options;
    private final List<String> fields = new ArrayList<>();
    private final Map<String, FieldEntry> entries = new LinkedHashMap<>();
    private final Map<String, OutputKind> outputKeys = new LinkedHashMap<>();

    private int spacerCount;
    private int modCount;
    private int lengthModCount = -1;
    private int cachedLength;
    private boolean computingLength;
    private boolean inSetup;

    public Schema(String name, SchemaScope parent) {
        this(Map.of(NAME, name), parent);
    }

    /**
     * @param options schema options; {@code name} is required
     * @param parent  the declaring schema or catalog
     * @throws ConfigException if an option is invalid or missing, or the parent is null
     */
    public Schema(Map<String, ?> options, SchemaScope parent) {
        if (parent == null) {
            throw new ConfigException("Missing required option 'parent' for schema '"
                    + (options == null ? null : options.get(NAME)) + "'");
        }
        this.parent = parent;
        this.options = new Options(DEFINITIONS, "schema '" + (options == null ? null : options.get(NAME)) + "'", options);
        this.options.merge(parent.getOptions(), MergePolicy.FILL_MISSING);
    }

    @Override
    public String getName() {
        return options.get(NAME, String.class);
    }

    public SchemaScope getParent() {
        return parent;
    }

    @Override
    public Options getOptions() {
        return options;
    }

    /**
     * Dotted path from the outermost schema, e.g. {@code HEADER.totals}.
     */
    public String getPath() {
        return parent instanceof Schema s ? s.getPath() + "." + getName() : getName();
    }

    public boolean isOptional() {
        return options.getBoolean(OPTIONAL);
    }

    public boolean isSingular() {
        return options.getBoolean(SINGULAR);
    }

    public Object getOption(String name) {
        if (!DEFINITIONS.isReadable(name)) {
            throw new ConfigException("Option '" + name + "' of schema '" + getName() + "' is not readable");
        }
        return options.get(name);
    }

    /**
     * Changes a writable option of this schema. Fields declared afterwards inherit the new value;
     * columns already declared keep the value they copied when they were declared.
     */
    public void setOption(String name, Object value) {
        if (!DEFINITIONS.isWritable(name)) {
            throw new ConfigException("Option '" + name + "' of schema '" + getName() + "' is not writable");
        }
        options.set(name, value);
    }

    @SuppressWarnings("unchecked")
    public Predicate<String> getTrap() {
        return options.get(TRAP, Predicate.class);
    }

    /**
     * Installs a predicate the raw line must also satisfy for {@link #match(String)}.
     */
    public Schema trap(Predicate<String> trap) {
        options.set(TRAP, trap);
        return this;
    }

    // ---- declaration ----

    /**
     * Runs a declaration block against this schema.
     *
     * @throws SchemaException if the block is null, or when called again from inside the block
     */
    public Schema setup(Consumer<Schema> block) {
        if (inSetup) {
            throw new SchemaException("Schema '" + getPath() + "' is already in setup; recursion forbidden");
        }
        if (block == null) {
            throw new SchemaException("Setup of schema '" + getPath() + "' requires a block");
        }
        inSetup = true;
        try {
            block.accept(this);
        } finally {
            inSetup = false;
        }
        return this;
    }

    public Column column(String name, int length) {
        return column(name, length, Map.of());
    }

    /**
     * Appends a column.
     *
     * @throws ConfigException        on invalid options or a reserved name
     * @throws DuplicateNameException if the name (or its group) clashes with an existing field
     */
    public Column column(String name, int length, Map<String, ?> columnOptions) {
        Map<String, Object> all = new LinkedHashMap<>();
        if (columnOptions != null) {
            all.putAll(columnOptions);
        }
        all.put(Column.NAME, name);
        all.put(Column.LENGTH, length);

        Column column = new Column(all);
        checkReserved(column.getName());
        String group = column.getGroup();
        if (group != null) {
            checkReserved(group);
        }
        checkColumnDuplicates(group, column.getName());

        column.getOptions().merge(options, MergePolicy.FILL_MISSING);
        register(new ColumnEntry(column));
        if (group != null) {
            outputKeys.putIfAbsent(group, OutputKind.GROUP);
        } else {
            outputKeys.put(column.getName(), OutputKind.COLUMN);
        }
        return column;
    }

    public Column spacer(int length) {
        return spacer(length, null);
    }

    /**
     * Appends a filler column named {@code spacer_N}. Fillers take up width but never appear in
     * parsed records.
     */
    public Column spacer(int length, Character padding) {
        String name;
        do {
            name = RESERVED_PREFIXES.get(0) + "_" + (++spacerCount);
        } while (entries.containsKey(name));

        Column column = Column.spacer(name, length, padding);
        column.getOptions().merge(options, MergePolicy.FILL_MISSING);
        register(new ColumnEntry(column));
        return column;
    }

    public Schema schema(String name, Consumer<Schema> setup) {
        return schema(name, Map.of(), setup);
    }

    /**
     * Declares a nested schema and runs {@code setup} on it. Nothing is registered if the name is
     * rejected or the setup block fails.
     */
    public Schema schema(String name, Map<String, ?> schemaOptions, Consumer<Schema> setup) {
        checkFieldName(name);
        for (FieldEntry entry : entries.values()) {
            if (entry instanceof ReferenceEntry ref && (name.equals(ref.getSchemaName())
                    || (ref.isResolved() && name.equals(ref.getTarget().getName())))) {
                throw new DuplicateNameException("Schema '" + getPath() + "' already has reference '"
                        + ref.getStoreName() + "' to a schema named '" + name
                        + "'; you cannot also declare a nested schema with that name");
            }
        }

        Map<String, Object> all = new LinkedHashMap<>();
        if (schemaOptions != null) {
            all.putAll(schemaOptions);
        }
        all.put(NAME, name);
        Schema child = new Schema(all, this);
        if (setup != null) {
            child.setup(setup);
        }

        register(new NestedSchemaEntry(child));
        outputKeys.put(name, OutputKind.SCHEMA);
        return child;
    }

    public ReferenceEntry reference(String schemaName) {
        return reference(schemaName, schemaName, Map.of());
    }

    public ReferenceEntry reference(String storeName, String schemaName) {
        return reference(storeName, schemaName, Map.of());
    }

    /**
     * Appends a field laid out by the schema named {@code schemaName}, resolved on first use.
     *
     * @param storeName      key of the sub-record in parsed output; defaults to the schema name
     * @param schemaName     schema to look up through the parent chain
     * @param carriedOptions options pushed into the target once resolved
     */
    public ReferenceEntry reference(String storeName, String schemaName, Map<String, ?> carriedOptions) {
        if (schemaName == null || schemaName.isBlank()) {
            throw new SchemaException("Reference '" + storeName + "' in schema '" + getPath()
                    + "' is missing a schema name");
        }
        String target = schemaName.trim();
        if (!OptionRules.isIdentifier(target)) {
            throw new SchemaException("Reference in schema '" + getPath() + "' names an invalid schema '"
                    + schemaName + "'");
        }
        String store = storeName == null ? target : storeName.trim();
        checkFieldName(store);

        Options carried = new Options(INHERITABLE_DEFINITIONS, "reference '" + store + "'", carriedOptions);
        ReferenceEntry entry = new ReferenceEntry(target, store, carried);
        register(entry);
        outputKeys.put(store, OutputKind.REFERENCE);
        return entry;
    }

    private void register(FieldEntry entry) {
        fields.add(entry.getId());
        entries.put(entry.getId(), entry);
        modCount++;
        log.debug("Schema '{}': added {}", getPath(), entry);
    }

    private void checkFieldName(String name) {
        if (!OptionRules.isIdentifier(name)) {
            throw new ConfigException("Invalid name '" + name + "' in schema '" + getPath() + "': expected an identifier");
        }
        checkReserved(name);
        if (entries.containsKey(name) || outputKeys.containsKey(name)) {
            throw new DuplicateNameException("You have already defined a field named '" + name
                    + "' in schema '" + getPath() + "'");
        }
    }

    private void checkReserved(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String prefix : RESERVED_PREFIXES) {
            if (lower.startsWith(prefix)) {
                throw new ConfigException("Invalid name '" + name + "': names starting with '" + prefix
                        + "' are reserved");
            }
        }
    }

    private void checkColumnDuplicates(String group, String name) {
        String groupLabel = group == null ? "default" : "'" + group + "'";
        if (entries.containsKey(ColumnEntry.idOf(group, name))) {
            throw new DuplicateNameException("You have already defined a column named '" + name
                    + "' in the " + groupLabel + " group of schema '" + getPath() + "'");
        }
        if (group != null) {
            OutputKind kind = outputKeys.get(group);
            if (kind != null && kind != OutputKind.GROUP) {
                throw new DuplicateNameException("You have already defined a " + describe(kind) + " named '"
                        + group + "' in schema '" + getPath() + "'; you cannot have a group with the same name");
            }
        } else {
            OutputKind kind = outputKeys.get(name);
            if (kind != null) {
                throw new DuplicateNameException("You have already defined a " + describe(kind) + " named '"
                        + name + "' in schema '" + getPath() + "'; you cannot have a column with the same name");
            }
        }
    }

    private static String describe(OutputKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    // ---- resolution ----

    /**
     * Returns the entry declared under {@code fieldName}, resolving it first if it is a reference.
     *
     * @throws SchemaException if there is no such field or the reference cannot be resolved
     */
    public FieldEntry lookup(String fieldName) {
        FieldEntry entry = entries.get(fieldName);
        if (entry == null) {
            throw new SchemaException("Schema '" + getPath() + "' has no field named '" + fieldName + "'");
        }
        if (entry instanceof ReferenceEntry ref) {
            resolve(ref);
        }
        return entry;
    }

    /**
     * Finds the schema visible under {@code name} from this scope: a nested schema of this
     * schema, the target of a reference stored under that name, or anything visible from the
     * parent.
     */
    public Schema lookupSchema(String name) {
        FieldEntry entry = entries.get(name);
        if (entry == null) {
            return lookupInParent(name);
        }
        if (entry instanceof NestedSchemaEntry nested) {
            return nested.getSchema();
        }
        if (entry instanceof ReferenceEntry ref) {
            return resolve(ref);
        }
        throw new SchemaException("'" + name + "' in schema '" + getPath() + "' is a column, not a schema");
    }

    /**
     * Binds {@code ref} to its target schema on first call and memoizes the result.
     */
    Schema resolve(ReferenceEntry ref) {
        if (ref.isResolved()) {
            return ref.getTarget();
        }

        Schema target;
        try {
            FieldEntry own = entries.get(ref.getSchemaName());
            target = own instanceof NestedSchemaEntry nested ? nested.getSchema() : lookupInParent(ref.getSchemaName());
        } catch (SchemaException e) {
            ref.markFailed(e.getMessage());
            throw new SchemaException("Cannot resolve field '" + ref.getStoreName() + "' of schema '"
                    + getPath() + "': " + e.getMessage(), e);
        }

        ref.markResolved(target);
        log.debug("Resolved reference '{}' of schema '{}' to '{}'", ref.getStoreName(), getPath(), target.getPath());

        if (ref.markApplied(ref.getCarriedOptions())) {
            propagate(target, ref.getCarriedOptions());
        }
        if (ref.markApplied(options)) {
            propagate(target, options);
        }
        for (Options queued : ref.drainPending()) {
            propagate(target, queued);
        }
        return target;
    }

    private Schema lookupInParent(String name) {
        if (parent instanceof Schema schema) {
            return schema.lookupSchema(name);
        }
        if (parent instanceof SchemaCatalog catalog) {
            List<Schema> candidates = catalog.lookupByName(name);
            if (!candidates.isEmpty()) {
                return candidates.get(0);
            }
        }
        throw new SchemaException("Cannot find a schema named '" + name + "' in '" + parent.getName()
                + "' or its ancestors");
    }

    /**
     * Fills gaps in the options of {@code target}, its columns and everything below it. References
     * not yet resolved keep the options queued until they are.
     */
    static void propagate(Schema target, Options inherited) {
        log.debug("Propagating {} into schema '{}'", inherited, target.getPath());
        target.options.merge(inherited, MergePolicy.FILL_MISSING);
        for (FieldEntry entry : target.entries.values()) {
            if (entry instanceof ColumnEntry columnEntry) {
                columnEntry.getColumn().getOptions().merge(inherited, MergePolicy.FILL_MISSING);
            } else if (entry instanceof NestedSchemaEntry nested) {
                propagate(nested.getSchema(), inherited);
            } else if (entry instanceof ReferenceEntry ref && ref.markApplied(inherited)) {
                if (ref.isResolved()) {
                    propagate(ref.getTarget(), inherited);
                } else {
                    ref.queue(inherited);
                }
            }
        }
    }

    // ---- traversal ----

    /**
     * Total width in characters. Cached until the field list changes.
     *
     * @throws SchemaException if a reference cannot be resolved or the layout contains itself
     */
    public int length() {
        if (lengthModCount == modCount) {
            return cachedLength;
        }
        if (computingLength) {
            throw new SchemaException("Recursive layout: schema '" + getPath() + "' contains itself");
        }
        computingLength = true;
        try {
            int total = 0;
            for (String id : fields) {
                total += lengthOf(lookup(id));
            }
            cachedLength = total;
            lengthModCount = modCount;
            return total;
        } finally {
            computingLength = false;
        }
    }

    private int lengthOf(FieldEntry entry) {
        if (entry instanceof ColumnEntry columnEntry) {
            return columnEntry.getColumn().getLength();
        }
        if (entry instanceof NestedSchemaEntry nested) {
            return nested.getSchema().length();
        }
        if (entry instanceof ReferenceEntry ref) {
            return ref.getTarget().length();
        }
        throw new SchemaException("Unknown field type: " + entry);
    }

    public Map<String, Object> parse(String line) {
        return parse(line, 0);
    }

    /**
     * Parses the record starting at code point {@code start} of {@code line}. Characters missing
     * at the end of the line read as empty.
     *
     * @return field values in layout order; nested schemas and references map to sub-records,
     *         grouped columns are collected under their group, spacers are left out
     */
    public Map<String, Object> parse(String line, int start) {
        Objects.requireNonNull(line, "line");
        if (start < 0) {
            throw new SchemaException("Schema '" + getPath() + "' cannot parse from negative position " + start);
        }
        length();

        Map<String, Object> data = new LinkedHashMap<>();
        int cursor = start;
        for (String id : fields) {
            FieldEntry entry = lookup(id);
            if (entry instanceof ColumnEntry columnEntry) {
                Column column = columnEntry.getColumn();
                if (!column.isSpacer()) {
                    Object value = column.parse(CodePointUtil.slice(line, cursor, column.getLength()));
                    store(data, column, value);
                }
                cursor += column.getLength();
            } else if (entry instanceof NestedSchemaEntry nested) {
                Schema schema = nested.getSchema();
                data.put(nested.getOutputKey(), schema.parse(line, cursor));
                cursor += schema.length();
            } else if (entry instanceof ReferenceEntry ref) {
                Schema schema = ref.getTarget();
                data.put(ref.getOutputKey(), schema.parse(line, cursor));
                cursor += schema.length();
            } else {
                throw new SchemaException("Unknown field type: " + entry);
            }
        }
        return data;
    }

    @SuppressWarnings("unchecked")
    private static void store(Map<String, Object> data, Column column, Object value) {
        String group = column.getGroup();
        if (group == null) {
            data.put(column.getName(), value);
        } else {
            ((Map<String, Object>) data.computeIfAbsent(group, g -> new LinkedHashMap<String, Object>()))
                    .put(column.getName(), value);
        }
    }

    /**
     * Formats {@code record} into a line of exactly {@link #length()} characters. Absent values are
     * formatted as null, which columns render as padding.
     *
     * @throws SchemaException if a nested value is not a record
     */
    public String format(Map<String, ?> record) {
        length();
        Map<String, ?> data = record == null ? Map.of() : record;

        StringBuilder line = new StringBuilder();
        for (String id : fields) {
            FieldEntry entry = lookup(id);
            if (entry instanceof ColumnEntry columnEntry) {
                Column column = columnEntry.getColumn();
                line.append(column.format(column.isSpacer() ? null : valueOf(data, column)));
            } else if (entry instanceof NestedSchemaEntry nested) {
                Schema schema = nested.getSchema();
                line.append(schema.format(asRecord(data.get(nested.getOutputKey()), nested.getOutputKey())));
            } else if (entry instanceof ReferenceEntry ref) {
                line.append(ref.getTarget().format(asRecord(data.get(ref.getOutputKey()), ref.getOutputKey())));
            } else {
                throw new SchemaException("Unknown field type: " + entry);
            }
        }
        return line.toString();
    }

    private Object valueOf(Map<String, ?> data, Column column) {
        String group = column.getGroup();
        if (group == null) {
            return data.get(column.getName());
        }
        Map<String, ?> grouped = asRecord(data.get(group), group);
        return grouped == null ? null : grouped.get(column.getName());
    }

    @SuppressWarnings("unchecked")
    private Map<String, ?> asRecord(Object value, String key) {
        if (value == null || value instanceof Map<?, ?>) {
            return (Map<String, ?>) value;
        }
        throw new SchemaException("Field '" + key + "' of schema '" + getPath()
                + "' expects a nested record, but got a " + value.getClass().getSimpleName());
    }

    /**
     * Whether {@code line} can be a record of this schema: it is no longer than {@link #length()}
     * once trailing whitespace is dropped, and the trap, if any, accepts it.
     */
    public boolean match(String line) {
        if (line == null) {
            return false;
        }
        if (CodePointUtil.length(line.stripTrailing()) > length()) {
            return false;
        }
        Predicate<String> trap = getTrap();
        return trap == null || trap.test(line);
    }

    boolean isLengthSettled() {
        return lengthModCount == modCount;
    }

    // ---- validation ----

    /**
     * Collects every resolution problem in this schema and everything it reaches. Never throws.
     */
    public List<SchemaProblem> validate() {
        Set<SchemaProblem> problems = new LinkedHashSet<>();
        collectProblems(problems, Collections.newSetFromMap(new IdentityHashMap<>()));
        return List.copyOf(problems);
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * @throws SchemaValidationException carrying every problem {@link #validate()} reports
     */
    public Schema requireValid() {
        List<SchemaProblem> problems = validate();
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(problems);
        }
        length();
        return this;
    }

    private void collectProblems(Set<SchemaProblem> problems, Set<Schema> path) {
        if (!path.add(this)) {
            problems.add(new SchemaProblem(getPath(), null, "Recursive layout: schema '" + getPath() + "' contains itself"));
            return;
        }
        try {
            for (String id : fields) {
                FieldEntry entry = entries.get(id);
                if (entry instanceof NestedSchemaEntry nested) {
                    nested.getSchema().collectProblems(problems, path);
                } else if (entry instanceof ReferenceEntry ref) {
                    Schema target;
                    try {
                        target = resolve(ref);
                    } catch (SchemaException e) {
                        problems.add(new SchemaProblem(getPath(), ref.getStoreName(), e.getMessage()));
                        continue;
                    }
                    target.collectProblems(problems, path);
                } else if (!(entry instanceof ColumnEntry)) {
                    problems.add(new SchemaProblem(getPath(), id, "Unknown field type: " + entry));
                }
            }
        } finally {
            path.remove(this);
        }
    }

    // ---- introspection ----

    /**
     * Field identifiers in layout order.
     */
    public List<String> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public Map<String, FieldEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public List<Column> getColumns() {
        return entries.values().stream()
                .filter(ColumnEntry.class::isInstance)
                .map(e -> ((ColumnEntry) e).getColumn())
                .toList();
    }

    public List<Schema> getNestedSchemas() {
        return entries.values().stream()
                .filter(NestedSchemaEntry.class::isInstance)
                .map(e -> ((NestedSchemaEntry) e).getSchema())
                .toList();
    }

    public List<ReferenceEntry> getReferences() {
        return entries.values().stream()
                .filter(ReferenceEntry.class::isInstance)
                .map(ReferenceEntry.class::cast)
                .toList();
    }

    private static OptionSpec flag(String name) {
        return OptionSpec.builder().name(name)
                .transform(OptionRules.TO_BOOLEAN).validator(OptionRules.IS_BOOLEAN)
                .expectation("true or false").defaultValue(false).build();
    }

    @Override
    public String toString() {
        return "Schema[" + getPath() + ", fields=" + fields + "]";
    }
}
