package io.datashape.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datashape.core.model.Issue;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.spi.IssueFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Thrown by {@code parse} (and carried by a failed {@code ParseResult}) when data does not satisfy a
 * schema. Holds every collected issue in report order; the exception message is produced by the
 * issue formatter that was active when the parse started.
 */
public final class ValidationException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final transient List<Issue> issues;
    private final transient IssueFormatter formatter;

    public ValidationException(List<Issue> issues, IssueFormatter formatter) {
        super(null, Phase.PARSE);
        this.issues = List.copyOf(issues);
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    public List<Issue> issues() {
        return issues;
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    @Override
    public String getMessage() {
        return formatter.format(issues);
    }

    /** Error tree with each issue's resolved message. */
    public FormattedErrors format() {
        return format(Issue::message);
    }

    /**
     * Error tree keyed by path segment. Union failures contribute the issues of every member and
     * function failures contribute their nested issues, instead of their own message.
     */
    public FormattedErrors format(Function<Issue, String> mapper) {
        FormattedErrors root = new FormattedErrors();
        collect(issues, root, mapper);
        return root;
    }

    private static void collect(List<Issue> issues, FormattedErrors root, Function<Issue, String> mapper) {
        for (Issue issue : issues) {
            if (issue.payload() instanceof IssuePayload.InvalidUnion union) {
                collect(union.unionIssues(), root, mapper);
            } else if (issue.payload() instanceof IssuePayload.NestedError nested) {
                collect(nested.error().issues(), root, mapper);
            } else {
                root.add(issue.path(), mapper.apply(issue));
            }
        }
    }

    /** Messages grouped by first path segment. */
    public FlattenedErrors flatten() {
        return flatten(Issue::message);
    }

    public FlattenedErrors flatten(Function<Issue, String> mapper) {
        List<String> formErrors = new ArrayList<>();
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        for (Issue issue : issues) {
            String message = mapper.apply(issue);
            if (issue.path().isEmpty()) {
                formErrors.add(message);
            } else {
                fieldErrors
                        .computeIfAbsent(String.valueOf(issue.path().get(0)), k -> new ArrayList<>())
                        .add(message);
            }
        }
        fieldErrors.replaceAll((k, v) -> List.copyOf(v));
        return new FlattenedErrors(formErrors, fieldErrors);
    }

    /** Issues rendered as a JSON array of {@code {code, path, message}} objects. */
    public JsonNode toJson() {
        ArrayNode array = MAPPER.createArrayNode();
        for (Issue issue : issues) {
            array.add(issueToJson(issue));
        }
        return array;
    }

    static ObjectNode issueToJson(Issue issue) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", issue.kind().code());
        ArrayNode path = node.putArray("path");
        for (Object segment : issue.path()) {
            if (segment instanceof Integer index) {
                path.add(index);
            } else {
                path.add(String.valueOf(segment));
            }
        }
        node.put("message", issue.message());
        return node;
    }
}
