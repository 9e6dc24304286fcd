package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datashape.core.error.ValidationException;
import io.datashape.core.model.Issue;

/**
 * Renders a {@link ValidationException} as an RFC 9457 Problem Details document, for services that
 * return validation failures over HTTP.
 *
 * <pre>
 * {
 *   "type": "urn:datashape:error:validation-failed",
 *   "title": "Validation Failed",
 *   "status": 422,
 *   "detail": "...",
 *   "instance": "/orders",
 *   "issues": [{"code": "invalid_type", "path": ["items", 0], "message": "..."}]
 * }
 * </pre>
 *
 * <p>Thread-safe and immutable.
 */
public final class ProblemDetailsBuilder {

    public static final String URN = "urn:datashape:error:validation-failed";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;
    private static final String DEFAULT_TITLE = "Validation Failed";

    private final int status;

    /** Creates a builder with HTTP status 422. */
    public ProblemDetailsBuilder() {
        this(DEFAULT_STATUS);
    }

    public ProblemDetailsBuilder(int status) {
        this.status = status;
    }

    /**
     * @param exception    the validation failure
     * @param instancePath the request path, may be null
     */
    public JsonNode build(ValidationException exception, String instancePath) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("type", URN);
        response.put("title", DEFAULT_TITLE);
        response.put("status", status);
        response.put("detail", summary(exception));
        if (instancePath != null) {
            response.put("instance", instancePath);
        } else {
            response.putNull("instance");
        }
        ArrayNode issues = response.putArray("issues");
        exception.toJson().forEach(issues::add);
        return response;
    }

    public int status() {
        return status;
    }

    private static String summary(ValidationException exception) {
        if (exception.issues().size() == 1) {
            Issue issue = exception.issues().get(0);
            String path = issue.formattedPath();
            return path.isEmpty() ? issue.message() : path + ": " + issue.message();
        }
        return exception.issues().size() + " validation issues";
    }
}
