package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.ParseOptions;
import io.datashape.core.error.ValidationException;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import io.datashape.core.spi.SchemaFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Accepts a function and returns a wrapper that validates every call: the arguments against the
 * {@code args} tuple before the call and the return value against {@code returns} after it.
 *
 * <p>A failing call throws a {@link ValidationException} holding one {@code INVALID_ARGUMENTS} or
 * {@code INVALID_RETURN_TYPE} issue whose payload carries the nested error.
 */
public final class FunctionSchema extends Schema<SchemaFunction> {

    private final TupleSchema args;
    private final Schema<?> returns;

    FunctionSchema(TupleSchema args, Schema<?> returns, SchemaOptions options) {
        super(options);
        this.args = args;
        this.returns = returns;
    }

    public TupleSchema parameters() {
        return args;
    }

    public Schema<?> returnType() {
        return returns;
    }

    /** Copy of this node with the given positional argument nodes. */
    public FunctionSchema args(Schema<?>... items) {
        return new FunctionSchema(new TupleSchema(List.of(items), null, SchemaOptions.NONE), returns, options());
    }

    /** Copy of this node with the given return node. */
    public FunctionSchema returns(Schema<?> node) {
        return new FunctionSchema(args, node, options());
    }

    /** Wraps {@code fn} so that every call is validated. */
    public SchemaFunction implement(SchemaFunction fn) {
        return parse(fn);
    }

    @Override
    public TypeName typeName() {
        return TypeName.FUNCTION;
    }

    @Override
    public String hint() {
        List<String> parts = new ArrayList<>();
        args.items().forEach(item -> parts.add(item.hint()));
        if (args.rest() != null) {
            parts.add("..." + args.rest().hint() + "[]");
        }
        return "(" + String.join(", ", parts) + ") => " + returns.hint();
    }

    @Override
    CompletableFuture<ParseResult<SchemaFunction>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        if (ctx.dataType() != ParsedType.FUNCTION) {
            ctx.invalidType(ParsedType.FUNCTION);
            return ctx.abort();
        }
        SchemaFunction target = data instanceof SchemaFunction fn ? fn : adapt(data);
        ParseOptions options = ctx.common().toOptions(ctx.config());
        SchemaFunction validated = callArgs -> {
            ParseResult<List<Object>> parsedArgs = args.safeParse(new ArrayList<>(callArgs), options);
            if (!parsedArgs.ok()) {
                throw failure(IssueKind.INVALID_ARGUMENTS, parsedArgs.error(), callArgs, options);
            }
            Object result = target.call(parsedArgs.data());
            ParseResult<?> parsedResult = returns.safeParse(result, options);
            if (!parsedResult.ok()) {
                throw failure(IssueKind.INVALID_RETURN_TYPE, parsedResult.error(), result, options);
            }
            return parsedResult.data();
        };
        return ctx.ok(validated);
    }

    @SuppressWarnings("unchecked")
    private static SchemaFunction adapt(Object data) {
        Function<Object, Object> fn = (Function<Object, Object>) data;
        return callArgs -> fn.apply(callArgs.isEmpty() ? Undefined.INSTANCE : callArgs.get(0));
    }

    private ValidationException failure(
            IssueKind kind, ValidationException nested, Object data, ParseOptions options) {
        ParseContext ctx = ParseContext.root(this, data, options, false);
        ctx.report(kind, new IssuePayload.NestedError(nested));
        return ctx.error();
    }

    @Override
    FunctionSchema withOptions(SchemaOptions next) {
        return new FunctionSchema(args, returns, next);
    }
}
