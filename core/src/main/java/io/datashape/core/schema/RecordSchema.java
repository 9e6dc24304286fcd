package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dictionary with arbitrary keys: every key of the input map is validated by the key node and its
 * value by the value node, both at path {@code [key]}. Entries whose value parses to
 * {@link Undefined#INSTANCE} are omitted.
 *
 * @param <K> key output type
 * @param <V> value output type
 */
public final class RecordSchema<K, V> extends Schema<Map<K, V>> {

    private final Schema<K> keys;
    private final Schema<V> values;

    RecordSchema(Schema<K> keys, Schema<V> values, SchemaOptions options) {
        super(options);
        this.keys = keys;
        this.values = values;
    }

    public Schema<K> keySchema() {
        return keys;
    }

    public Schema<V> valueSchema() {
        return values;
    }

    @Override
    public TypeName typeName() {
        return TypeName.RECORD;
    }

    @Override
    public String hint() {
        return "Record<" + keys.hint() + ", " + values.hint() + ">";
    }

    @Override
    CompletableFuture<ParseResult<Map<K, V>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.OBJECT) {
            ctx.invalidType(ParsedType.OBJECT);
            return ctx.abort();
        }
        List<Map.Entry<?, ?>> entries = new ArrayList<>(((Map<?, ?>) ctx.data()).entrySet());
        Map<K, V> out = new LinkedHashMap<>();
        return Steps.sequence(entries.size(), i -> {
                    Map.Entry<?, ?> entry = entries.get(i);
                    Object key = entry.getKey();
                    return keys.doParse(ctx.child(keys, key, key)).thenCompose(parsedKey -> {
                        if (!parsedKey.ok() && ctx.abortEarly()) {
                            return CompletableFuture.completedFuture(false);
                        }
                        return values.doParse(ctx.child(values, entry.getValue(), key))
                                .thenApply(parsedValue -> {
                                    if (parsedKey.ok()
                                            && parsedValue.ok()
                                            && parsedValue.data() != Undefined.INSTANCE) {
                                        out.put(parsedKey.data(), parsedValue.data());
                                    }
                                    return parsedValue.ok() || !ctx.abortEarly();
                                });
                    });
                })
                .thenCompose(done -> ctx.result(out));
    }

    @Override
    RecordSchema<K, V> withOptions(SchemaOptions next) {
        return new RecordSchema<>(keys, values, next);
    }
}
