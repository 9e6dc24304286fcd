package io.datashape.core.spi;

import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;

/** What the parse engine needs to know about the node it is running. */
public interface SchemaNode {

    TypeName typeName();

    /** Human-readable description of the accepted shape, e.g. {@code string | number}. */
    String hint();

    SchemaOptions options();
}
