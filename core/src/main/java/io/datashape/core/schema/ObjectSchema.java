package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import io.datashape.core.spi.ErrorMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Keyed-object node: an ordered shape of named fields plus a rule for keys outside the shape.
 *
 * <p>Declared fields are validated in declaration order; a field whose parsed value is
 * {@link Undefined#INSTANCE} is left out of the output. Extra keys are handled by the catchall node
 * if one is set, otherwise by the {@link UnknownKeys} policy. A catchall and a policy are mutually
 * exclusive: setting one clears the other.
 *
 * <p>Every derived operation returns a new node; field order is preserved throughout.
 */
public final class ObjectSchema extends Schema<Map<String, Object>> {

    /** What happens to input keys that are not in the shape. */
    public enum UnknownKeys {
        /** Dropped silently. */
        STRIP,
        /** Kept verbatim, unvalidated. */
        PASSTHROUGH,
        /** Reported as one {@code UNRECOGNIZED_KEYS} issue. */
        STRICT
    }

    private final Map<String, Schema<?>> shape;
    private final UnknownKeys unknownKeys;
    private final Schema<?> catchall;

    ObjectSchema(
            Map<String, ? extends Schema<?>> shape,
            UnknownKeys unknownKeys,
            Schema<?> catchall,
            SchemaOptions options) {
        super(options);
        this.shape = Collections.unmodifiableMap(new LinkedHashMap<>(shape));
        this.catchall = catchall;
        this.unknownKeys = catchall != null ? null : (unknownKeys != null ? unknownKeys : UnknownKeys.STRIP);
    }

    private ObjectSchema withShape(Map<String, ? extends Schema<?>> next) {
        return new ObjectSchema(next, unknownKeys, catchall, options());
    }

    /** Fields in declaration order. */
    public Map<String, Schema<?>> shape() {
        return shape;
    }

    /** (name, node) pairs in declaration order. */
    public List<Map.Entry<String, Schema<?>>> entries() {
        List<Map.Entry<String, Schema<?>>> entries = new ArrayList<>(shape.size());
        shape.forEach((name, node) -> entries.add(Map.entry(name, node)));
        return Collections.unmodifiableList(entries);
    }

    /** The unknown-key policy, or {@code null} when a catchall is set. */
    public UnknownKeys unknownKeys() {
        return unknownKeys;
    }

    /** The catchall node, or {@code null} when a policy is set. */
    public Schema<?> catchallSchema() {
        return catchall;
    }

    @Override
    public ObjectSchema errorMap(ErrorMap map) {
        return withOptions(options().withErrorMap(map));
    }

    @Override
    public ObjectSchema abortEarly(boolean value) {
        return withOptions(options().withAbortEarly(value));
    }

    // --- Unknown keys ---

    public ObjectSchema strip() {
        return new ObjectSchema(shape, UnknownKeys.STRIP, null, options());
    }

    public ObjectSchema passthrough() {
        return new ObjectSchema(shape, UnknownKeys.PASSTHROUGH, null, options());
    }

    public ObjectSchema strict() {
        return new ObjectSchema(shape, UnknownKeys.STRICT, null, options());
    }

    /** Validates every extra key's value against {@code node} and keeps it. */
    public ObjectSchema catchall(Schema<?> node) {
        return new ObjectSchema(shape, null, node, options());
    }

    // --- Shape derivation ---

    /** Adds fields; on a name collision the incoming field wins. */
    public ObjectSchema extend(Map<String, ? extends Schema<?>> fields) {
        Map<String, Schema<?>> next = new LinkedHashMap<>(shape);
        next.putAll(fields);
        return withShape(next);
    }

    /** Alias of {@link #extend}. */
    public ObjectSchema augment(Map<String, ? extends Schema<?>> fields) {
        return extend(fields);
    }

    public ObjectSchema setKey(String name, Schema<?> node) {
        Map<String, Schema<?>> field = new LinkedHashMap<>();
        field.put(name, node);
        return extend(field);
    }

    /**
     * Extends with {@code other}'s fields. The result is {@code other}'s definition over the combined
     * shape: its unknown-key policy, catchall and options (error map, abort-early) replace this node's.
     */
    public ObjectSchema merge(ObjectSchema other) {
        Map<String, Schema<?>> next = new LinkedHashMap<>(shape);
        next.putAll(other.shape);
        return new ObjectSchema(next, other.unknownKeys, other.catchall, other.options());
    }

    /** Keeps only the named fields, in their original order. */
    public ObjectSchema pick(String... names) {
        Set<String> keep = Set.of(names);
        Map<String, Schema<?>> next = new LinkedHashMap<>();
        shape.forEach((name, node) -> {
            if (keep.contains(name)) {
                next.put(name, node);
            }
        });
        return withShape(next);
    }

    /** Removes the named fields. */
    public ObjectSchema omit(String... names) {
        Map<String, Schema<?>> next = new LinkedHashMap<>(shape);
        for (String name : names) {
            next.remove(name);
        }
        return withShape(next);
    }

    /**
     * Symmetric difference: keeps the fields whose name occurs in exactly one of this shape and
     * {@code fields}, each with its own side's node. Fields present on both sides are dropped.
     * This node's unique fields come first, then the argument's.
     */
    public ObjectSchema diff(Map<String, ? extends Schema<?>> fields) {
        Map<String, Schema<?>> next = new LinkedHashMap<>();
        shape.forEach((name, node) -> {
            if (!fields.containsKey(name)) {
                next.put(name, node);
            }
        });
        fields.forEach((name, node) -> {
            if (!shape.containsKey(name)) {
                next.put(name, node);
            }
        });
        return withShape(next);
    }

    /** Symmetric difference with another object node's shape. */
    public ObjectSchema diff(ObjectSchema other) {
        return diff(other.shape);
    }

    /** Makes every field optional. */
    public ObjectSchema partial() {
        return partial(shape.keySet());
    }

    /** Makes the named fields optional; fields that already are stay as they are. */
    public ObjectSchema partial(String... names) {
        return partial(Set.of(names));
    }

    private ObjectSchema partial(Set<String> names) {
        Map<String, Schema<?>> next = new LinkedHashMap<>();
        shape.forEach((name, node) ->
                next.put(name, names.contains(name) && !(node instanceof OptionalSchema) ? node.optional() : node));
        return withShape(next);
    }

    /** Makes every field optional, recursing into nested objects, array elements and wrappers. */
    public ObjectSchema partialDeep() {
        Map<String, Schema<?>> next = new LinkedHashMap<>();
        shape.forEach((name, node) -> {
            Schema<?> deep = deepPartial(node);
            next.put(name, deep instanceof OptionalSchema ? deep : deep.optional());
        });
        return new ObjectSchema(next, unknownKeys, catchall, options());
    }

    private static Schema<?> deepPartial(Schema<?> node) {
        if (node instanceof ObjectSchema object) {
            return object.partialDeep();
        }
        if (node instanceof ArraySchema<?> array) {
            return new ArraySchema<>(deepPartial(array.element()), array.checks(), array.options());
        }
        if (node instanceof OptionalSchema<?> optional) {
            return deepPartial(optional.unwrap()).optional();
        }
        if (node instanceof NullableSchema<?> nullable) {
            return deepPartial(nullable.unwrap()).nullable();
        }
        return node;
    }

    /** Strips optional wrappers from every field; nullable wrappers are kept. */
    public ObjectSchema required() {
        return required(shape.keySet());
    }

    public ObjectSchema required(String... names) {
        return required(Set.of(names));
    }

    private ObjectSchema required(Set<String> names) {
        Map<String, Schema<?>> next = new LinkedHashMap<>();
        shape.forEach((name, node) -> next.put(name, names.contains(name) ? deoptional(node) : node));
        return withShape(next);
    }

    private static Schema<?> deoptional(Schema<?> node) {
        if (node instanceof OptionalSchema<?> optional) {
            return deoptional(optional.unwrap());
        }
        if (node instanceof NullableSchema<?> nullable) {
            return deoptional(nullable.unwrap()).nullable();
        }
        return node;
    }

    /** Enum of this shape's field names. */
    public EnumSchema keyof() {
        return new EnumSchema(new ArrayList<>(shape.keySet()), SchemaOptions.NONE);
    }

    // --- Node ---

    @Override
    public TypeName typeName() {
        return TypeName.OBJECT;
    }

    @Override
    public String hint() {
        if (shape.isEmpty()) {
            return "{}";
        }
        List<String> fields = new ArrayList<>(shape.size());
        shape.forEach((name, node) -> fields.add(node instanceof OptionalSchema<?> optional
                ? name + "?: " + optional.unwrap().hint()
                : name + ": " + node.hint()));
        return "{ " + String.join(", ", fields) + " }";
    }

    @Override
    CompletableFuture<ParseResult<Map<String, Object>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.OBJECT) {
            ctx.invalidType(ParsedType.OBJECT);
            return ctx.abort();
        }
        Map<?, ?> input = (Map<?, ?>) ctx.data();
        List<String> names = new ArrayList<>(shape.keySet());
        List<String> extras = new ArrayList<>();
        input.keySet().forEach(key -> {
            String name = String.valueOf(key);
            if (!shape.containsKey(name)) {
                extras.add(name);
            }
        });
        Map<String, Object> out = new LinkedHashMap<>();
        return Steps.sequence(names.size(), i -> {
                    String name = names.get(i);
                    Schema<?> node = shape.get(name);
                    return parseField(ctx, node, lookup(input, name), name, out);
                })
                .<ParseResult<Map<String, Object>>>thenCompose(done -> {
                    if (ctx.isInvalid() && ctx.abortEarly()) {
                        return ctx.abort();
                    }
                    return handleExtras(ctx, input, extras, out);
                });
    }

    private CompletableFuture<ParseResult<Map<String, Object>>> handleExtras(
            ParseContext ctx, Map<?, ?> input, List<String> extras, Map<String, Object> out) {
        if (catchall != null) {
            return Steps.sequence(extras.size(), i -> {
                        String name = extras.get(i);
                        return parseField(ctx, catchall, lookup(input, name), name, out);
                    })
                    .thenCompose(done -> ctx.result(out));
        }
        if (unknownKeys == UnknownKeys.PASSTHROUGH) {
            extras.forEach(name -> out.put(name, lookup(input, name)));
        } else if (unknownKeys == UnknownKeys.STRICT && !extras.isEmpty()) {
            ctx.report(IssueKind.UNRECOGNIZED_KEYS, new IssuePayload.UnrecognizedKeys(extras));
        }
        return ctx.result(out);
    }

    private static CompletableFuture<Boolean> parseField(
            ParseContext ctx, Schema<?> node, Object value, String name, Map<String, Object> out) {
        return node.doParse(ctx.child(node, value, name)).thenApply(result -> {
            if (result.ok() && result.data() != Undefined.INSTANCE) {
                out.put(name, result.data());
            }
            return result.ok() || !ctx.abortEarly();
        });
    }

    private static Object lookup(Map<?, ?> input, String name) {
        if (input.containsKey(name)) {
            return input.get(name);
        }
        for (Map.Entry<?, ?> entry : input.entrySet()) {
            if (name.equals(String.valueOf(entry.getKey()))) {
                return entry.getValue();
            }
        }
        return Undefined.INSTANCE;
    }

    @Override
    ObjectSchema withOptions(SchemaOptions next) {
        return new ObjectSchema(shape, unknownKeys, catchall, next);
    }
}
