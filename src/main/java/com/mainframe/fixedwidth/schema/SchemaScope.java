package com.mainframe.fixedwidth.schema;

import com.mainframe.fixedwidth.option.Options;

/**
 * Something a schema can be declared in: another schema or a root catalog. Provides the
 * options a new schema inherits.
 */
public interface SchemaScope {

    String getName();

    Options getOptions();
}
