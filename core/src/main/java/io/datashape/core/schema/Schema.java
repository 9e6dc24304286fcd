package io.datashape.core.schema;

import io.datashape.core.engine.EffectContext;
import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.ParseOptions;
import io.datashape.core.engine.Steps;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import io.datashape.core.spi.ErrorMap;
import io.datashape.core.spi.SchemaNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * An immutable validation rule. Nodes compose into graphs that may share sub-nodes freely; every
 * derived-schema operation returns a new node and leaves the receiver untouched.
 *
 * <p>One execution path serves both parse modes. Each node runs as a step returning a
 * {@link CompletableFuture}; a synchronous parse requires every step to complete immediately and
 * fails with {@link io.datashape.core.error.AsyncUsageException} otherwise.
 *
 * <p>Thread-safe: a node may be parsed concurrently from any number of call sites.
 *
 * @param <O> output type, where Java can express it; {@code Object} otherwise
 */
public abstract sealed class Schema<O> implements SchemaNode
        permits LeafSchema,
                BooleanSchema,
                DateSchema,
                LiteralSchema,
                EnumSchema,
                InstanceOfSchema,
                OptionalSchema,
                NullableSchema,
                DefaultSchema,
                CatchSchema,
                BrandedSchema,
                LazySchema,
                PromiseSchema,
                ArraySchema,
                SetSchema,
                TupleSchema,
                RecordSchema,
                MapSchema,
                ObjectSchema,
                UnionSchema,
                IntersectionSchema,
                EffectsSchema,
                FunctionSchema {

    private final SchemaOptions options;

    Schema(SchemaOptions options) {
        this.options = options != null ? options : SchemaOptions.NONE;
    }

    @Override
    public abstract TypeName typeName();

    @Override
    public abstract String hint();

    @Override
    public final SchemaOptions options() {
        return options;
    }

    /** Runs this node against {@code ctx}. */
    abstract CompletableFuture<ParseResult<O>> doParse(ParseContext ctx);

    /** Re-types a step; parse results are read-only, so widening the output type is safe. */
    @SuppressWarnings("unchecked")
    static <T> CompletableFuture<ParseResult<T>> widen(CompletableFuture<? extends ParseResult<?>> step) {
        return (CompletableFuture<ParseResult<T>>) step;
    }

    /** Copy of this node with different options. */
    abstract Schema<O> withOptions(SchemaOptions next);

    /** Copy of this node with a schema-level error map. */
    public Schema<O> errorMap(ErrorMap map) {
        return withOptions(options.withErrorMap(map));
    }

    /** Copy of this node that aborts early by default when it is the parse root. */
    public Schema<O> abortEarly(boolean value) {
        return withOptions(options.withAbortEarly(value));
    }

    // --- Parsing ---

    /**
     * Validates {@code data} synchronously.
     *
     * @throws io.datashape.core.error.ValidationException if the data is invalid
     * @throws io.datashape.core.error.AsyncUsageException if a traversed node needs to suspend
     */
    public final O parse(Object data) {
        return parse(data, ParseOptions.DEFAULT);
    }

    public final O parse(Object data, ParseOptions parseOptions) {
        return safeParse(data, parseOptions).orElseThrow();
    }

    /** Validates {@code data} synchronously; invalid data yields a failed result instead of a throw. */
    public final ParseResult<O> safeParse(Object data) {
        return safeParse(data, ParseOptions.DEFAULT);
    }

    public final ParseResult<O> safeParse(Object data, ParseOptions parseOptions) {
        ParseContext ctx = ParseContext.root(this, data, parseOptions, false);
        return Steps.join(doParse(ctx));
    }

    /** Validates {@code data}; the future fails with the validation error if the data is invalid. */
    public final CompletableFuture<O> parseAsync(Object data) {
        return parseAsync(data, ParseOptions.DEFAULT);
    }

    public final CompletableFuture<O> parseAsync(Object data, ParseOptions parseOptions) {
        return safeParseAsync(data, parseOptions).thenApply(ParseResult::orElseThrow);
    }

    public final CompletableFuture<ParseResult<O>> safeParseAsync(Object data) {
        return safeParseAsync(data, ParseOptions.DEFAULT);
    }

    public final CompletableFuture<ParseResult<O>> safeParseAsync(Object data, ParseOptions parseOptions) {
        return Steps.guard(() -> doParse(ParseContext.root(this, data, parseOptions, true)));
    }

    /** {@code true} iff a synchronous safe parse of {@code data} succeeds. */
    public final boolean is(Object data) {
        return safeParse(data).ok();
    }

    /** {@code true} iff this node accepts an absent value. */
    public boolean isOptional() {
        return safeParse(Undefined.INSTANCE).ok();
    }

    /** {@code true} iff this node accepts {@code null}. */
    public boolean isNullable() {
        return safeParse(null).ok();
    }

    /**
     * Strips optional, nullable, lazy, promise and effects wrappers until a node of another kind is
     * reached.
     */
    public Schema<?> unwrapDeep() {
        Schema<?> current = this;
        while (true) {
            if (current instanceof OptionalSchema<?> optional) {
                current = optional.unwrap();
            } else if (current instanceof NullableSchema<?> nullable) {
                current = nullable.unwrap();
            } else if (current instanceof LazySchema<?> lazy) {
                current = lazy.unwrap();
            } else if (current instanceof PromiseSchema<?> promise) {
                current = promise.unwrap();
            } else if (current instanceof EffectsSchema<?, ?> effects) {
                current = effects.unwrap();
            } else {
                return current;
            }
        }
    }

    // --- Wrappers ---

    public OptionalSchema<O> optional() {
        return new OptionalSchema<>(this, SchemaOptions.NONE);
    }

    public NullableSchema<O> nullable() {
        return new NullableSchema<>(this, SchemaOptions.NONE);
    }

    /** Accepts absent values and {@code null}. */
    public OptionalSchema<O> nullish() {
        return nullable().optional();
    }

    public ArraySchema<O> array() {
        return new ArraySchema<>(this, List.of(), SchemaOptions.NONE);
    }

    public PromiseSchema<O> promise() {
        return new PromiseSchema<>(this, SchemaOptions.NONE);
    }

    /** Union of this node and the given alternatives, in that order. */
    public UnionSchema or(Schema<?> alternative, Schema<?>... more) {
        List<Schema<?>> members = new ArrayList<>(2 + more.length);
        members.add(this);
        members.add(alternative);
        members.addAll(List.of(more));
        return new UnionSchema(members, SchemaOptions.NONE);
    }

    /** Intersection of this node and {@code other}. */
    public IntersectionSchema and(Schema<?> other) {
        return new IntersectionSchema(List.of(this, other), SchemaOptions.NONE);
    }

    /** Marks this node with a brand name; no runtime effect. */
    public BrandedSchema<O> brand(String brand) {
        return new BrandedSchema<>(this, brand, SchemaOptions.NONE);
    }

    /** Substitutes {@code value} for absent input. */
    public DefaultSchema<O> withDefault(O value) {
        return new DefaultSchema<>(this, () -> value, SchemaOptions.NONE);
    }

    /** Substitutes a freshly generated value for absent input. */
    public DefaultSchema<O> withDefault(Supplier<? extends O> generator) {
        return new DefaultSchema<>(this, generator, SchemaOptions.NONE);
    }

    /** Returns {@code value} instead of failing. */
    public CatchSchema<O> withCatch(O value) {
        return new CatchSchema<>(this, () -> value, SchemaOptions.NONE);
    }

    public CatchSchema<O> withCatch(Supplier<? extends O> generator) {
        return new CatchSchema<>(this, generator, SchemaOptions.NONE);
    }

    /** Wraps this node in a lazy indirection. */
    public LazySchema<O> lazy() {
        return new LazySchema<>(() -> this, SchemaOptions.NONE);
    }

    // --- Effects ---

    /** Fails with a {@code CUSTOM} issue when {@code check} rejects the validated value. */
    public EffectsSchema<O, O> refine(Predicate<? super O> check) {
        return refine(check, RefineMessage.of(null));
    }

    public EffectsSchema<O, O> refine(Predicate<? super O> check, String message) {
        return refine(check, RefineMessage.of(message));
    }

    public EffectsSchema<O, O> refine(Predicate<? super O> check, RefineMessage<? super O> message) {
        return EffectsSchema.refinement(this, check::test, message);
    }

    /**
     * Refinement whose verdict arrives later. Only usable with {@link #parseAsync} and
     * {@link #safeParseAsync}.
     */
    public EffectsSchema<O, O> refineAsync(
            Function<? super O, ? extends CompletionStage<Boolean>> check, String message) {
        return refineAsync(check, RefineMessage.of(message));
    }

    public EffectsSchema<O, O> refineAsync(
            Function<? super O, ? extends CompletionStage<Boolean>> check, RefineMessage<? super O> message) {
        return EffectsSchema.refinement(this, check::apply, message);
    }

    /** Refinement that reports its own issues through the {@link EffectContext}. */
    public EffectsSchema<O, O> superRefine(BiConsumer<? super O, EffectContext> check) {
        return EffectsSchema.transformation(this, (value, effects) -> {
            check.accept(value, effects);
            return value;
        });
    }

    /** Maps the validated value to a new output. */
    public <N> EffectsSchema<O, N> transform(Function<? super O, ? extends N> fn) {
        return EffectsSchema.transformation(this, (value, effects) -> fn.apply(value));
    }

    /** Maps the validated value; the function may report issues through the {@link EffectContext}. */
    public <N> EffectsSchema<O, N> transform(BiFunction<? super O, EffectContext, ? extends N> fn) {
        return EffectsSchema.transformation(this, fn::apply);
    }

    /** Transform producing a deferred value. Only usable with asynchronous parses. */
    public <N> EffectsSchema<O, N> transformAsync(Function<? super O, ? extends CompletionStage<? extends N>> fn) {
        return EffectsSchema.transformation(this, (value, effects) -> fn.apply(value));
    }

    /** Converts raw input with {@code fn} before this node validates it. */
    public EffectsSchema<O, O> preprocess(Function<Object, ?> fn) {
        return EffectsSchema.preprocessing(this, fn);
    }

    @Override
    public String toString() {
        return typeName() + "(" + hint() + ")";
    }
}
