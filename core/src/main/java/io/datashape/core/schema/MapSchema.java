package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Key/value store node. Entries are addressed by position: a key failure is reported at
 * {@code [index, "key"]} and a value failure at {@code [index, "value"]}.
 *
 * @param <K> key output type
 * @param <V> value output type
 */
public final class MapSchema<K, V> extends Schema<Map<K, V>> {

    private final Schema<K> keys;
    private final Schema<V> values;

    MapSchema(Schema<K> keys, Schema<V> values, SchemaOptions options) {
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
        return TypeName.MAP;
    }

    @Override
    public String hint() {
        return "Map<" + keys.hint() + ", " + values.hint() + ">";
    }

    @Override
    CompletableFuture<ParseResult<Map<K, V>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.OBJECT) {
            ctx.invalidType(ParsedType.MAP);
            return ctx.abort();
        }
        List<Map.Entry<?, ?>> entries = new ArrayList<>(((Map<?, ?>) ctx.data()).entrySet());
        Map<K, V> out = new LinkedHashMap<>();
        return Steps.sequence(entries.size(), i -> {
                    Map.Entry<?, ?> entry = entries.get(i);
                    ParseContext entryCtx = ctx.child(this, entry.getValue(), i);
                    return keys.doParse(entryCtx.child(keys, entry.getKey(), "key")).thenCompose(parsedKey -> {
                        if (!parsedKey.ok() && ctx.abortEarly()) {
                            return CompletableFuture.completedFuture(false);
                        }
                        return values.doParse(entryCtx.child(values, entry.getValue(), "value"))
                                .thenApply(parsedValue -> {
                                    if (parsedKey.ok() && parsedValue.ok()) {
                                        out.put(parsedKey.data(), parsedValue.data());
                                    }
                                    return parsedValue.ok() || !ctx.abortEarly();
                                });
                    });
                })
                .thenCompose(done -> ctx.result(out));
    }

    @Override
    MapSchema<K, V> withOptions(SchemaOptions next) {
        return new MapSchema<>(keys, values, next);
    }
}
