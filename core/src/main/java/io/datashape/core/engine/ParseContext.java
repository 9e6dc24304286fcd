package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.datashape.core.error.ValidationException;
import io.datashape.core.model.Check;
import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.Undefined;
import io.datashape.core.spi.ErrorMap;
import io.datashape.core.spi.ErrorMap.ErrorMapContext;
import io.datashape.core.spi.SchemaNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-node parse state: the data under validation, its path, the node being run, the issues
 * collected so far and a link to the enclosing context.
 *
 * <p>Contexts form a tree. A {@linkplain #child child} descends one path segment; a
 * {@linkplain #forNode linked copy} stays at the same path for wrappers and effects. Reporting an
 * issue marks the reporting context and every linked ancestor invalid and copies the issue upward,
 * so the root always holds every issue in report order. An {@linkplain #isolated isolated} context
 * keeps its ancestry for error-map lookup but never propagates status or issues; union members and
 * fallbacks run in one.
 *
 * <p>Reads through {@link #data()} return a deep copy, so nodes never mutate caller data.
 *
 * <p>Thread-safe: members of async unions and intersections may report concurrently.
 */
public final class ParseContext {

    private static final Logger LOG = LoggerFactory.getLogger(ParseContext.class);

    /** Validity of a context and everything reported beneath it. */
    public enum Status {
        VALID,
        INVALID
    }

    /**
     * Settings shared by every context of one parse, fixed when the parse starts.
     *
     * @param abortEarly stop at the first issue
     * @param debug      log each issue
     * @param async      whether deferred values may be awaited
     * @param errorMap   call-site error map, or {@code null}
     * @param global     global configuration snapshot
     */
    public record Common(boolean abortEarly, boolean debug, boolean async, ErrorMap errorMap, GlobalSettings global) {

        /** Options equivalent to these settings, for parses started from inside this one. */
        public ParseOptions toOptions(GlobalConfig config) {
            return new ParseOptions(abortEarly, debug, errorMap, config);
        }
    }

    private final SchemaNode schema;
    private final List<Object> path;
    private final ParseContext parent;
    private final boolean detached;
    private final Common common;
    private final GlobalConfig config;
    private final List<ParseContext> children = new CopyOnWriteArrayList<>();
    private final List<Issue> issues = new CopyOnWriteArrayList<>();
    private volatile Status status = Status.VALID;
    private volatile Object data;

    private ParseContext(
            SchemaNode schema,
            Object data,
            List<Object> path,
            ParseContext parent,
            boolean detached,
            Common common,
            GlobalConfig config) {
        this.schema = schema;
        this.data = data;
        this.path = path;
        this.parent = parent;
        this.detached = detached;
        this.common = common;
        this.config = config;
    }

    /**
     * Creates the root context of a parse. Option precedence is call-site, then the root schema's
     * own options, then the global configuration. A {@link JsonNode} input is converted to plain
     * values first.
     */
    public static ParseContext root(SchemaNode schema, Object data, ParseOptions options, boolean async) {
        ParseOptions call = options != null ? options : ParseOptions.DEFAULT;
        GlobalConfig config = call.resolvedConfig();
        GlobalSettings global = config.snapshot();
        boolean abortEarly;
        if (call.abortEarly() != null) {
            abortEarly = call.abortEarly();
        } else if (schema.options().abortEarly() != null) {
            abortEarly = schema.options().abortEarly();
        } else {
            abortEarly = global.options().abortEarly();
        }
        boolean debug = call.debug() != null ? call.debug() : global.options().debug();
        Object input = data instanceof JsonNode node ? JsonValues.toPlain(node) : data;
        Common common = new Common(abortEarly, debug, async, call.errorMap(), global);
        return new ParseContext(schema, input, List.of(), null, false, common, config);
    }

    /** Linked context one path segment deeper, for a container element. */
    public ParseContext child(SchemaNode node, Object childData, Object segment) {
        List<Object> childPath = new ArrayList<>(path.size() + 1);
        childPath.addAll(path);
        childPath.add(segment);
        return register(new ParseContext(
                node, childData, Collections.unmodifiableList(childPath), this, false, common, config));
    }

    /** Linked context at the same path, for wrappers, intersections and effects. */
    public ParseContext forNode(SchemaNode node) {
        return register(new ParseContext(node, data(), path, this, false, common, config));
    }

    /** Context at the same path whose status and issues stay local. */
    public ParseContext isolated(SchemaNode node) {
        return new ParseContext(node, data(), path, this, true, common, config);
    }

    private ParseContext register(ParseContext context) {
        children.add(context);
        return context;
    }

    /** Deep copy of the data under validation. */
    public Object data() {
        return Values.deepCopy(data);
    }

    /** The data under validation without copying; callers must not mutate it. */
    public Object rawData() {
        return data;
    }

    public ParsedType dataType() {
        return ParsedType.of(data);
    }

    public ParseContext setData(Object value) {
        this.data = value;
        return this;
    }

    public SchemaNode schema() {
        return schema;
    }

    public List<Object> path() {
        return path;
    }

    /** Enclosing context, or {@code null} for the root. */
    public ParseContext parent() {
        return parent;
    }

    public List<ParseContext> children() {
        return Collections.unmodifiableList(children);
    }

    public Common common() {
        return common;
    }

    /** Global configuration this parse was started with. */
    public GlobalConfig config() {
        return config;
    }

    public boolean isAsync() {
        return common.async();
    }

    public boolean abortEarly() {
        return common.abortEarly();
    }

    public Status status() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    /** Issues reported at or beneath this context, in report order. */
    public List<Issue> issues() {
        return List.copyOf(issues);
    }

    /**
     * Records an issue against the current data. An {@code INVALID_TYPE} issue on absent data is
     * reported as {@code REQUIRED}. Does nothing when this context is already invalid and the parse
     * aborts early.
     */
    public ParseContext report(IssueKind kind, IssuePayload payload) {
        if (status == Status.INVALID && common.abortEarly()) {
            return this;
        }
        IssueKind effectiveKind = kind;
        IssuePayload effectivePayload = payload;
        if (kind == IssueKind.INVALID_TYPE && data == Undefined.INSTANCE) {
            effectiveKind = IssueKind.REQUIRED;
            effectivePayload = IssuePayload.None.INSTANCE;
        }
        Issue issue = Issue.create(
                effectiveKind,
                effectivePayload,
                path,
                new Issue.Input(data, ParsedType.of(data)),
                new Issue.Type(schema.typeName(), schema.hint()));
        issue = issue.withMessage(resolveMessage(issue));
        if (common.debug()) {
            LOG.debug(
                    "Issue reported: kind={}, path={}, type={}, message={}",
                    issue.kind().code(),
                    issue.path(),
                    schema.typeName(),
                    issue.message());
        }
        ParseContext current = this;
        while (current != null) {
            current.status = Status.INVALID;
            current.issues.add(issue);
            current = current.detached ? null : current.parent;
        }
        return this;
    }

    public ParseContext invalidType(ParsedType expected) {
        return report(IssueKind.INVALID_TYPE, new IssuePayload.InvalidType(expected, dataType()));
    }

    public ParseContext checkFailed(IssueKind kind, Check check) {
        return report(kind, new IssuePayload.CheckFailed(check));
    }

    public ParseContext custom(IssuePayload.Custom payload) {
        return report(IssueKind.CUSTOM, payload);
    }

    /** Successful step result. */
    public <T> CompletableFuture<ParseResult<T>> ok(T value) {
        return CompletableFuture.completedFuture(ParseResult.success(value));
    }

    /** Failed step result carrying every issue collected at or beneath this context. */
    public <T> CompletableFuture<ParseResult<T>> abort() {
        return CompletableFuture.completedFuture(ParseResult.failure(error()));
    }

    /** {@link #ok} when this context is still valid, otherwise {@link #abort}. */
    public <T> CompletableFuture<ParseResult<T>> result(T value) {
        return isValid() ? ok(value) : abort();
    }

    /** Validation error for the issues collected at or beneath this context. */
    public ValidationException error() {
        return new ValidationException(issues, common.global().issueFormatter());
    }

    /**
     * Folds the message layers: built-in default, global map, nearest schema-level map, call-site
     * map. A payload-supplied message overrides all of them.
     */
    private String resolveMessage(Issue issue) {
        String message = DefaultErrorMap.INSTANCE.message(issue, new ErrorMapContext(null));
        message = applyLayer(common.global().errorMap(), issue, message);
        message = applyLayer(nearestSchemaErrorMap(), issue, message);
        message = applyLayer(common.errorMap(), issue, message);
        String override = issue.payload().message();
        return override != null && !override.isEmpty() ? override : message;
    }

    private ErrorMap nearestSchemaErrorMap() {
        for (ParseContext current = this; current != null; current = current.parent) {
            ErrorMap map = current.schema.options().errorMap();
            if (map != null) {
                return map;
            }
        }
        return null;
    }

    private static String applyLayer(ErrorMap layer, Issue issue, String defaultMessage) {
        if (layer == null) {
            return defaultMessage;
        }
        String message = layer.message(issue, new ErrorMapContext(defaultMessage));
        return message != null && !message.isEmpty() ? message : defaultMessage;
    }

    @Override
    public String toString() {
        return "ParseContext[path=" + path + ", type=" + schema.typeName() + ", status=" + status + "]";
    }
}
