package io.datashape.core.schema;

import io.datashape.core.engine.IntersectionMerger;
import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.error.SchemaDefinitionException;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts input that every member accepts. Member outputs are folded left to right through
 * {@link IntersectionMerger}; a pair that cannot be reconciled fails the node with one
 * {@code INVALID_INTERSECTION} issue.
 *
 * <p>Members run in linked contexts, so their issues are reported directly. Asynchronous parses
 * start every member at once; the fold order is fixed regardless of completion order.
 */
public final class IntersectionSchema extends Schema<Object> {

    private final List<Schema<?>> members;

    IntersectionSchema(List<? extends Schema<?>> members, SchemaOptions options) {
        super(options);
        if (members.size() < 2) {
            throw new SchemaDefinitionException("Intersection requires at least two members; got " + members.size());
        }
        this.members = List.copyOf(members);
    }

    public List<Schema<?>> members() {
        return members;
    }

    @Override
    public TypeName typeName() {
        return TypeName.INTERSECTION;
    }

    @Override
    public String hint() {
        List<String> parts = new ArrayList<>(members.size());
        members.forEach(member -> parts.add(member.hint()));
        return String.join(" & ", parts);
    }

    @Override
    CompletableFuture<ParseResult<Object>> doParse(ParseContext ctx) {
        return ctx.isAsync() ? parseConcurrently(ctx) : parseInOrder(ctx);
    }

    private CompletableFuture<ParseResult<Object>> parseInOrder(ParseContext ctx) {
        List<ParseResult<?>> results = new ArrayList<>();
        return Steps.sequence(members.size(), i -> {
                    Schema<?> member = members.get(i);
                    return member.doParse(ctx.forNode(member)).thenApply(result -> {
                        results.add(result);
                        return result.ok() || !ctx.abortEarly();
                    });
                })
                .thenCompose(done -> fold(ctx, results));
    }

    private CompletableFuture<ParseResult<Object>> parseConcurrently(ParseContext ctx) {
        List<CompletableFuture<? extends ParseResult<?>>> pending = new ArrayList<>(members.size());
        for (Schema<?> member : members) {
            pending.add(Steps.guard(() -> widen(member.doParse(ctx.forNode(member)))));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenCompose(done -> {
                    List<ParseResult<?>> results = new ArrayList<>(pending.size());
                    pending.forEach(future -> results.add(future.join()));
                    return fold(ctx, results);
                });
    }

    private static CompletableFuture<ParseResult<Object>> fold(ParseContext ctx, List<ParseResult<?>> results) {
        if (ctx.isInvalid() || results.stream().anyMatch(result -> !result.ok())) {
            return ctx.abort();
        }
        Object merged = results.get(0).data();
        for (int i = 1; i < results.size(); i++) {
            IntersectionMerger.Merged next = IntersectionMerger.merge(merged, results.get(i).data());
            if (!next.valid()) {
                ctx.report(IssueKind.INVALID_INTERSECTION, IssuePayload.None.INSTANCE);
                return ctx.abort();
            }
            merged = next.data();
        }
        return ctx.ok(merged);
    }

    @Override
    IntersectionSchema withOptions(SchemaOptions next) {
        return new IntersectionSchema(members, next);
    }
}
