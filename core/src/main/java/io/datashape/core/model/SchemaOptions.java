package io.datashape.core.model;

import io.datashape.core.spi.ErrorMap;

/**
 * Options attached to a single schema node. Either field may be {@code null}, meaning the node
 * does not override the global setting.
 *
 * @param errorMap   schema-level error map layer
 * @param abortEarly stop at the first issue when this node is the parse root
 */
public record SchemaOptions(ErrorMap errorMap, Boolean abortEarly) {

    public static final SchemaOptions NONE = new SchemaOptions(null, null);

    public SchemaOptions withErrorMap(ErrorMap map) {
        return new SchemaOptions(map, abortEarly);
    }

    public SchemaOptions withAbortEarly(Boolean value) {
        return new SchemaOptions(errorMap, value);
    }
}
