package io.datashape.core.schema;

import io.datashape.core.engine.EffectContext;
import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.engine.Values;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Wraps an underlying node with one effect.
 *
 * <ul>
 *   <li>preprocess: converts the raw input, then delegates
 *   <li>refinement: delegates, then reports a {@code CUSTOM} issue if the check is falsy
 *   <li>transformation: delegates, then maps the validated value; skipped if the delegate failed
 * </ul>
 *
 * <p>Effect functions may return a {@link java.util.concurrent.CompletionStage}. Asynchronous
 * parses await it; synchronous parses reject it with
 * {@link io.datashape.core.error.AsyncUsageException}, except for preprocess results, which are
 * handed to the underlying node as-is.
 *
 * @param <I> output type of the underlying node
 * @param <O> output type of this node
 */
public final class EffectsSchema<I, O> extends Schema<O> {

    /** The effect applied around the underlying node. */
    public sealed interface Effect<I> {}

    /** Converts raw input before validation. */
    public record Preprocess<I>(Function<Object, ?> fn) implements Effect<I> {}

    /** Checks the validated value; a falsy verdict fails with the described message. */
    public record Refinement<I>(Function<? super I, ?> check, RefineMessage<? super I> message) implements Effect<I> {}

    /** Maps the validated value. */
    public record Transformation<I>(BiFunction<? super I, EffectContext, ?> fn) implements Effect<I> {}

    private final Schema<I> underlying;
    private final Effect<I> effect;

    EffectsSchema(Schema<I> underlying, Effect<I> effect, SchemaOptions options) {
        super(options);
        this.underlying = underlying;
        this.effect = effect;
    }

    static <I> EffectsSchema<I, I> refinement(
            Schema<I> underlying, Function<? super I, ?> check, RefineMessage<? super I> message) {
        return new EffectsSchema<>(underlying, new Refinement<>(check, message), SchemaOptions.NONE);
    }

    static <I, O> EffectsSchema<I, O> transformation(Schema<I> underlying, BiFunction<? super I, EffectContext, ?> fn) {
        return new EffectsSchema<>(underlying, new Transformation<>(fn), SchemaOptions.NONE);
    }

    static <I> EffectsSchema<I, I> preprocessing(Schema<I> underlying, Function<Object, ?> fn) {
        return new EffectsSchema<>(underlying, new Preprocess<>(fn), SchemaOptions.NONE);
    }

    public Schema<I> unwrap() {
        return underlying;
    }

    public Effect<I> effect() {
        return effect;
    }

    @Override
    public TypeName typeName() {
        return TypeName.EFFECTS;
    }

    @Override
    public String hint() {
        return underlying.hint();
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        if (effect instanceof Preprocess<I> preprocess) {
            return preprocess(ctx, preprocess);
        }
        if (effect instanceof Refinement<I> refinement) {
            return refine(ctx, refinement);
        }
        return transform(ctx, (Transformation<I>) effect);
    }

    private CompletableFuture<ParseResult<O>> preprocess(ParseContext ctx, Preprocess<I> preprocess) {
        Object processed = preprocess.fn().apply(ctx.data());
        CompletableFuture<Object> ready =
                ctx.isAsync() ? Steps.await(ctx, processed) : CompletableFuture.completedFuture(processed);
        return ready.<ParseResult<O>>thenCompose(value -> {
            ctx.setData(value);
            return widen(underlying.doParse(ctx.forNode(underlying)));
        });
    }

    @SuppressWarnings("unchecked")
    private CompletableFuture<ParseResult<O>> refine(ParseContext ctx, Refinement<I> refinement) {
        return underlying.doParse(ctx.forNode(underlying)).<ParseResult<O>>thenCompose(result -> {
            if (!result.ok()) {
                return ctx.abort();
            }
            I value = result.data();
            return Steps.<Object>await(ctx, refinement.check().apply(value)).<ParseResult<O>>thenCompose(verdict -> {
                if (!Values.isTruthy(verdict)) {
                    IssuePayload.Custom payload = refinement.message().describe(value);
                    ctx.custom(payload != null ? payload : IssuePayload.Custom.of(null));
                    return ctx.abort();
                }
                return ctx.ok((O) value);
            });
        });
    }

    @SuppressWarnings("unchecked")
    private CompletableFuture<ParseResult<O>> transform(ParseContext ctx, Transformation<I> transformation) {
        return underlying.doParse(ctx.forNode(underlying)).<ParseResult<O>>thenCompose(result -> {
            if (!result.ok()) {
                return ctx.abort();
            }
            Object mapped = transformation.fn().apply(result.data(), new EffectContext(ctx));
            return Steps.<Object>await(ctx, mapped).thenCompose(value -> ctx.<O>result((O) value));
        });
    }

    @Override
    EffectsSchema<I, O> withOptions(SchemaOptions next) {
        return new EffectsSchema<>(underlying, effect, next);
    }
}
