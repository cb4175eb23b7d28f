package com.mainframe.fixedwidth.schema;

/**
 * Progress of a {@link ReferenceEntry} towards a concrete schema.
 */
public enum ResolutionState {
    UNRESOLVED,
    RESOLVED,
    /**
     * The last attempt failed. Retried on the next lookup, since the target may be declared later.
     */
    FAILED
}
