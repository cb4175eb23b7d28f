package com.mainframe.fixedwidth.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.mainframe.fixedwidth.option.Options;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

/**
 * A field whose layout is another schema, found by name on first use.
 *
 * The entry memoizes the target once found and holds option sets propagated to it before that
 * happened; they are handed over exactly once on resolution.
 */
@Getter
public class ReferenceEntry extends FieldEntry {

    /**
     * Name of the schema to resolve.
     */
    private final String schemaName;

    /**
     * Key the parsed sub-record is stored under.
     */
    private final String storeName;

    /**
     * Options given at the reference site, propagated into the target on resolution.
     */
    private final Options carriedOptions;

    private ResolutionState state = ResolutionState.UNRESOLVED;
    private Schema target;
    private String failure;

    @Getter(AccessLevel.NONE)
    private final List<Options> pending = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Set<Options> applied = Collections.newSetFromMap(new IdentityHashMap<>());

    public ReferenceEntry(@NonNull String schemaName, @NonNull String storeName, @NonNull Options carriedOptions) {
        this.schemaName = schemaName;
        this.storeName = storeName;
        this.carriedOptions = carriedOptions;
    }

    @Override
    public String getId() {
        return storeName;
    }

    @Override
    public String getOutputKey() {
        return storeName;
    }

    public boolean isResolved() {
        return state == ResolutionState.RESOLVED;
    }

    void markResolved(Schema schema) {
        this.target = schema;
        this.failure = null;
        this.state = ResolutionState.RESOLVED;
    }

    void markFailed(String reason) {
        this.failure = reason;
        this.state = ResolutionState.FAILED;
    }

    /**
     * Records that {@code options} has been (or is about to be) propagated through this
     * reference.
     *
     * @return false if it already was
     */
    boolean markApplied(Options options) {
        return applied.add(options);
    }

    void queue(Options options) {
        pending.add(options);
    }

    List<Options> drainPending() {
        List<Options> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    int pendingCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return "Reference[" + storeName + " -> " + schemaName + ", " + state + "]";
    }
}
