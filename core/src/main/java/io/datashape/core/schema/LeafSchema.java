package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Node that accepts or rejects its input by runtime classification alone.
 *
 * @param <O> output type
 */
public final class LeafSchema<O> extends Schema<O> {

    /** The leaf variants, each accepting exactly one classification (or all, or none). */
    public enum Kind {
        STRING(TypeName.STRING, ParsedType.STRING),
        NUMBER(TypeName.NUMBER, ParsedType.NUMBER),
        BIGINT(TypeName.BIGINT, ParsedType.BIGINT),
        SYMBOL(TypeName.SYMBOL, ParsedType.SYMBOL),
        NULL(TypeName.NULL, ParsedType.NULL),
        UNDEFINED(TypeName.UNDEFINED, ParsedType.UNDEFINED),
        VOID(TypeName.VOID, ParsedType.VOID),
        NAN(TypeName.NAN, ParsedType.NAN),
        TRUE(TypeName.TRUE, ParsedType.TRUE),
        FALSE(TypeName.FALSE, ParsedType.FALSE),
        ANY(TypeName.ANY, ParsedType.UNKNOWN),
        UNKNOWN(TypeName.UNKNOWN, ParsedType.UNKNOWN),
        NEVER(TypeName.NEVER, ParsedType.UNKNOWN);

        private final TypeName typeName;
        private final ParsedType expected;

        Kind(TypeName typeName, ParsedType expected) {
            this.typeName = typeName;
            this.expected = expected;
        }
    }

    private final Kind kind;

    LeafSchema(Kind kind, SchemaOptions options) {
        super(options);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public TypeName typeName() {
        return kind.typeName;
    }

    @Override
    public String hint() {
        return kind == Kind.NAN ? "NaN" : kind.name().toLowerCase(Locale.ROOT);
    }

    @Override
    @SuppressWarnings("unchecked")
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        ParsedType type = ctx.dataType();
        boolean accepted =
                switch (kind) {
                    case STRING, NUMBER, BIGINT, SYMBOL, NULL, UNDEFINED, NAN -> type == kind.expected;
                    case VOID -> type == ParsedType.UNDEFINED;
                    case TRUE -> Boolean.TRUE.equals(ctx.rawData());
                    case FALSE -> Boolean.FALSE.equals(ctx.rawData());
                    case ANY, UNKNOWN -> true;
                    case NEVER -> false;
                };
        if (accepted) {
            return ctx.ok((O) ctx.data());
        }
        if (kind == Kind.NEVER) {
            ctx.report(IssueKind.FORBIDDEN, IssuePayload.None.INSTANCE);
        } else {
            ctx.invalidType(kind.expected);
        }
        return ctx.abort();
    }

    @Override
    LeafSchema<O> withOptions(SchemaOptions next) {
        return new LeafSchema<>(kind, next);
    }
}
