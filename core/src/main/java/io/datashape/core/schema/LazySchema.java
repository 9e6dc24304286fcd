package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Indirection resolved on every use, which is what makes self-referential graphs possible: the
 * supplier may refer to a node that is still being defined.
 *
 * @param <O> output type
 */
public final class LazySchema<O> extends Schema<O> {

    private static final ThreadLocal<Set<LazySchema<?>>> RENDERING =
            ThreadLocal.withInitial(() -> Collections.newSetFromMap(new IdentityHashMap<>()));

    private final Supplier<? extends Schema<O>> getter;

    LazySchema(Supplier<? extends Schema<O>> getter, SchemaOptions options) {
        super(options);
        this.getter = Objects.requireNonNull(getter, "getter must not be null");
    }

    /** Resolves the inner node. */
    public Schema<O> schema() {
        return Objects.requireNonNull(getter.get(), "lazy schema resolved to null");
    }

    public Schema<O> unwrap() {
        return schema();
    }

    @Override
    public TypeName typeName() {
        return TypeName.LAZY;
    }

    /** The inner hint; a recursive reference renders as {@code ...}. */
    @Override
    public String hint() {
        Set<LazySchema<?>> rendering = RENDERING.get();
        if (!rendering.add(this)) {
            return "...";
        }
        try {
            return schema().hint();
        } finally {
            rendering.remove(this);
        }
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        Schema<O> resolved = schema();
        return resolved.doParse(ctx.forNode(resolved));
    }

    @Override
    LazySchema<O> withOptions(SchemaOptions next) {
        return new LazySchema<>(getter, next);
    }
}
