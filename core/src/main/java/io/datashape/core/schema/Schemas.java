package io.datashape.core.schema;

import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.Symbol;
import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for declaring schemas.
 *
 * <pre>{@code
 * ObjectSchema user = object(
 *         field("name", string()),
 *         field("age", number().optional()),
 *         field("tags", string().array().max(5)));
 * Map<String, Object> parsed = user.parse(input);
 * }</pre>
 */
public final class Schemas {

    private Schemas() {}

    // --- Leaves ---

    public static LeafSchema<String> string() {
        return leaf(LeafSchema.Kind.STRING);
    }

    /** Any number except NaN and {@link BigInteger}. */
    public static LeafSchema<Number> number() {
        return leaf(LeafSchema.Kind.NUMBER);
    }

    public static LeafSchema<BigInteger> bigint() {
        return leaf(LeafSchema.Kind.BIGINT);
    }

    public static LeafSchema<Symbol> symbol() {
        return leaf(LeafSchema.Kind.SYMBOL);
    }

    public static LeafSchema<Object> nullType() {
        return leaf(LeafSchema.Kind.NULL);
    }

    public static LeafSchema<Object> undefined() {
        return leaf(LeafSchema.Kind.UNDEFINED);
    }

    public static LeafSchema<Object> voidType() {
        return leaf(LeafSchema.Kind.VOID);
    }

    public static LeafSchema<Number> nan() {
        return leaf(LeafSchema.Kind.NAN);
    }

    public static LeafSchema<Boolean> trueValue() {
        return leaf(LeafSchema.Kind.TRUE);
    }

    public static LeafSchema<Boolean> falseValue() {
        return leaf(LeafSchema.Kind.FALSE);
    }

    public static LeafSchema<Object> any() {
        return leaf(LeafSchema.Kind.ANY);
    }

    public static LeafSchema<Object> unknown() {
        return leaf(LeafSchema.Kind.UNKNOWN);
    }

    /** Rejects every input with a {@code FORBIDDEN} issue. */
    public static LeafSchema<Object> never() {
        return leaf(LeafSchema.Kind.NEVER);
    }

    private static <O> LeafSchema<O> leaf(LeafSchema.Kind kind) {
        return new LeafSchema<>(kind, SchemaOptions.NONE);
    }

    public static BooleanSchema bool() {
        return new BooleanSchema(false, null, null, SchemaOptions.NONE);
    }

    public static DateSchema date() {
        return new DateSchema(DateSchema.Coercion.NONE, List.of(), Clock.systemUTC(), SchemaOptions.NONE);
    }

    public static <T> LiteralSchema<T> literal(T value) {
        return new LiteralSchema<>(value, SchemaOptions.NONE);
    }

    /** Enum of the given string or number values. */
    public static EnumSchema enumOf(Object... values) {
        return new EnumSchema(List.of(values), SchemaOptions.NONE);
    }

    public static EnumSchema enumOf(List<?> values) {
        return new EnumSchema(values, SchemaOptions.NONE);
    }

    /** Enum of the constant names of a Java enum. */
    public static EnumSchema enumOf(Class<? extends Enum<?>> type) {
        return EnumSchema.fromEnum(type);
    }

    public static <T> InstanceOfSchema<T> instanceOf(Class<T> type) {
        return new InstanceOfSchema<>(type, SchemaOptions.NONE);
    }

    // --- Wrappers ---

    public static <O> OptionalSchema<O> optional(Schema<O> schema) {
        return schema.optional();
    }

    public static <O> NullableSchema<O> nullable(Schema<O> schema) {
        return schema.nullable();
    }

    public static <O> PromiseSchema<O> promise(Schema<O> schema) {
        return schema.promise();
    }

    /** Node resolved from {@code getter} on every use; the way to declare recursive schemas. */
    public static <O> LazySchema<O> lazy(Supplier<? extends Schema<O>> getter) {
        return new LazySchema<>(getter, SchemaOptions.NONE);
    }

    /** Converts raw input with {@code fn} before {@code schema} validates it. */
    public static <O> EffectsSchema<O, O> preprocess(Function<Object, ?> fn, Schema<O> schema) {
        return schema.preprocess(fn);
    }

    // --- Composites ---

    public static <E> ArraySchema<E> array(Schema<E> element) {
        return element.array();
    }

    public static <E> SetSchema<E> set(Schema<E> element) {
        return new SetSchema<>(element, List.of(), SchemaOptions.NONE);
    }

    public static TupleSchema tuple(Schema<?>... items) {
        return new TupleSchema(List.of(items), null, SchemaOptions.NONE);
    }

    /** Dictionary with string keys. */
    public static <V> RecordSchema<String, V> record(Schema<V> values) {
        return new RecordSchema<>(string(), values, SchemaOptions.NONE);
    }

    public static <K, V> RecordSchema<K, V> record(Schema<K> keys, Schema<V> values) {
        return new RecordSchema<>(keys, values, SchemaOptions.NONE);
    }

    public static <K, V> MapSchema<K, V> map(Schema<K> keys, Schema<V> values) {
        return new MapSchema<>(keys, values, SchemaOptions.NONE);
    }

    /** A shape field, for {@link #object(Map.Entry[])}. */
    public static Map.Entry<String, Schema<?>> field(String name, Schema<?> schema) {
        return Map.entry(name, schema);
    }

    /** Object node with the given fields, in order. */
    @SafeVarargs
    public static ObjectSchema object(Map.Entry<String, ? extends Schema<?>>... fields) {
        Map<String, Schema<?>> shape = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Schema<?>> field : fields) {
            shape.put(field.getKey(), field.getValue());
        }
        return object(shape);
    }

    /** Object node over a shape; iteration order of {@code shape} becomes field order. */
    public static ObjectSchema object(Map<String, ? extends Schema<?>> shape) {
        return new ObjectSchema(shape, ObjectSchema.UnknownKeys.STRIP, null, SchemaOptions.NONE);
    }

    /** Union of at least two members. */
    public static UnionSchema union(Schema<?>... members) {
        return new UnionSchema(List.of(members), SchemaOptions.NONE);
    }

    public static UnionSchema union(List<? extends Schema<?>> members) {
        return new UnionSchema(members, SchemaOptions.NONE);
    }

    /** Intersection of at least two members. */
    public static IntersectionSchema intersection(Schema<?>... members) {
        return new IntersectionSchema(List.of(members), SchemaOptions.NONE);
    }

    /** Function node taking any arguments and returning anything. */
    public static FunctionSchema function() {
        return new FunctionSchema(tuple().rest(unknown()), unknown(), SchemaOptions.NONE);
    }

    public static FunctionSchema function(TupleSchema args, Schema<?> returns) {
        return new FunctionSchema(args, returns, SchemaOptions.NONE);
    }
}
