package io.datashape.core.testkit;

import static io.datashape.core.schema.Schemas.array;
import static io.datashape.core.schema.Schemas.bool;
import static io.datashape.core.schema.Schemas.enumOf;
import static io.datashape.core.schema.Schemas.field;
import static io.datashape.core.schema.Schemas.intersection;
import static io.datashape.core.schema.Schemas.lazy;
import static io.datashape.core.schema.Schemas.literal;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.object;
import static io.datashape.core.schema.Schemas.record;
import static io.datashape.core.schema.Schemas.string;
import static io.datashape.core.schema.Schemas.tuple;
import static io.datashape.core.schema.Schemas.union;

import io.datashape.core.schema.ObjectSchema;
import io.datashape.core.schema.Schema;
import java.util.List;
import java.util.Map;

/** Named schemas referenced by the YAML scenarios. */
public final class SchemaCatalog {

    static final ObjectSchema ADDRESS = object(field("city", string()), field("zip", string()));

    static final ObjectSchema USER = object(
            field("name", string()),
            field("email", string().refine(s -> s.contains("@"), "Invalid email")),
            field("role", enumOf("admin", "member").withDefault("member")),
            field("address", ADDRESS.optional()),
            field("tags", array(string()).max(3)));

    static final ObjectSchema CATEGORY = object(
            field("name", string()), field("children", array(lazy(() -> SchemaCatalog.CATEGORY))));

    static final Schema<Object> SHAPE = union(
            object(field("kind", literal("circle")), field("radius", number())),
            object(field("kind", literal("square")), field("side", number())));

    private static final Map<String, Schema<?>> SCHEMAS = Map.ofEntries(
            Map.entry("user", USER),
            Map.entry("user-strict", USER.strict()),
            Map.entry("user-partial", USER.partial()),
            Map.entry("category", CATEGORY),
            Map.entry("shape", SHAPE),
            Map.entry("point", tuple(number(), number()).rest(string())),
            Map.entry("flags", record(bool())),
            Map.entry("named-and-aged", intersection(object(field("name", string())), object(field("age", number())))),
            Map.entry("scores", array(number()).min(1).ascending(true)),
            Map.entry("nullable-list", array(string().nullable())),
            Map.entry(
                    "normalized-name",
                    object(field("name", string().transform(s -> s.trim().toLowerCase())))));

    private SchemaCatalog() {}

    /** Returns the schema registered under {@code name}. */
    public static Schema<?> get(String name) {
        Schema<?> schema = SCHEMAS.get(name);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown scenario schema: " + name + ", known: " + names());
        }
        return schema;
    }

    public static List<String> names() {
        return SCHEMAS.keySet().stream().sorted().toList();
    }
}
