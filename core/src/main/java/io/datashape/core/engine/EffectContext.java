package io.datashape.core.engine;

import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import java.util.List;
import java.util.Map;

/**
 * Handle passed to transforms: exposes the current path and lets the transform report issues
 * against the value it is transforming. A transform that reports an issue fails the parse even if
 * it returns normally.
 */
public final class EffectContext {

    private final ParseContext ctx;

    public EffectContext(ParseContext ctx) {
        this.ctx = ctx;
    }

    public List<Object> path() {
        return ctx.path();
    }

    public void addIssue(String message) {
        ctx.custom(IssuePayload.Custom.of(message));
    }

    public void addIssue(String message, Map<String, Object> params) {
        ctx.custom(new IssuePayload.Custom(message, params));
    }

    public void addIssue(IssueKind kind, IssuePayload payload) {
        ctx.report(kind, payload);
    }
}
