package com.mainframe.fixedwidth.schema;

import java.util.List;

/**
 * Root scope that can find top-level schemas by name. Consulted by reference resolution once
 * the ancestor chain of schemas is exhausted.
 */
public interface SchemaCatalog extends SchemaScope {

    /**
     * Candidate schemas named {@code name}, in declaration order. Empty when there is none.
     */
    List<Schema> lookupByName(String name);
}
