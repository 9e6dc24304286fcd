package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.error.SchemaDefinitionException;
import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accepts input that any member accepts and returns the output of the first member, in declared
 * order, that succeeds.
 *
 * <p>Each member runs in an isolated context, so a failing member leaves no trace unless every
 * member fails; then one {@code INVALID_UNION} issue carries all member issues in member order.
 * Synchronous parses try members one after another and stop at the first success. Asynchronous
 * parses start every member at once and pick the winner after all have settled.
 */
public final class UnionSchema extends Schema<Object> {

    private final List<Schema<?>> members;

    UnionSchema(List<? extends Schema<?>> members, SchemaOptions options) {
        super(options);
        if (members.size() < 2) {
            throw new SchemaDefinitionException("Union requires at least two members; got " + members.size());
        }
        this.members = List.copyOf(members);
    }

    public List<Schema<?>> members() {
        return members;
    }

    @Override
    public TypeName typeName() {
        return TypeName.UNION;
    }

    @Override
    public String hint() {
        List<String> parts = new ArrayList<>(members.size());
        members.forEach(member -> parts.add(member.hint()));
        return String.join(" | ", parts);
    }

    @Override
    CompletableFuture<ParseResult<Object>> doParse(ParseContext ctx) {
        return ctx.isAsync() ? parseConcurrently(ctx) : parseInOrder(ctx);
    }

    private CompletableFuture<ParseResult<Object>> parseInOrder(ParseContext ctx) {
        List<ParseResult<?>> results = new ArrayList<>();
        AtomicReference<ParseResult<?>> winner = new AtomicReference<>();
        return Steps.sequence(members.size(), i -> {
                    Schema<?> member = members.get(i);
                    return member.doParse(ctx.isolated(member)).thenApply(result -> {
                        results.add(result);
                        if (result.ok()) {
                            winner.set(result);
                        }
                        return !result.ok();
                    });
                })
                .thenCompose(done -> settle(ctx, winner.get(), results));
    }

    private CompletableFuture<ParseResult<Object>> parseConcurrently(ParseContext ctx) {
        List<CompletableFuture<? extends ParseResult<?>>> pending = new ArrayList<>(members.size());
        for (Schema<?> member : members) {
            pending.add(Steps.guard(() -> widen(member.doParse(ctx.isolated(member)))));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenCompose(done -> {
                    List<ParseResult<?>> results = new ArrayList<>(pending.size());
                    ParseResult<?> first = null;
                    for (CompletableFuture<? extends ParseResult<?>> future : pending) {
                        ParseResult<?> result = future.join();
                        results.add(result);
                        if (first == null && result.ok()) {
                            first = result;
                        }
                    }
                    return settle(ctx, first, results);
                });
    }

    private static CompletableFuture<ParseResult<Object>> settle(
            ParseContext ctx, ParseResult<?> winner, List<ParseResult<?>> results) {
        if (winner != null) {
            return ctx.ok(winner.data());
        }
        List<Issue> issues = new ArrayList<>();
        results.forEach(result -> issues.addAll(result.error().issues()));
        ctx.report(IssueKind.INVALID_UNION, new IssuePayload.InvalidUnion(issues));
        return ctx.abort();
    }

    @Override
    UnionSchema withOptions(SchemaOptions next) {
        return new UnionSchema(members, next);
    }
}
