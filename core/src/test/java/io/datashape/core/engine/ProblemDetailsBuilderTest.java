package io.datashape.core.engine;

import static io.datashape.core.schema.Schemas.field;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.object;
import static io.datashape.core.schema.Schemas.string;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.datashape.core.error.ValidationException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProblemDetailsBuilder}: validation failures rendered as RFC 9457 documents. */
@DisplayName("Problem details builder (RFC 9457)")
class ProblemDetailsBuilderTest {

    private ProblemDetailsBuilder builder;

    private static final ValidationException SINGLE =
            object(field("name", string())).safeParse(Map.of("name", 5)).error();

    private static final ValidationException MULTIPLE = object(field("name", string()), field("age", number()))
            .safeParse(Map.of())
            .error();

    @BeforeEach
    void setUp() {
        builder = new ProblemDetailsBuilder();
    }

    @Nested
    @DisplayName("Envelope")
    class Envelope {

        @Test
        @DisplayName("type is the validation-failed URN")
        void type_matchesUrn() {
            JsonNode response = builder.build(SINGLE, "/users");

            assertThat(response.get("type").asText()).isEqualTo(ProblemDetailsBuilder.URN);
            assertThat(response.get("type").asText()).isEqualTo("urn:datashape:error:validation-failed");
        }

        @Test
        @DisplayName("title is 'Validation Failed'")
        void title_isValidationFailed() {
            assertThat(builder.build(SINGLE, "/users").get("title").asText()).isEqualTo("Validation Failed");
        }

        @Test
        @DisplayName("status defaults to 422")
        void status_defaultsTo422() {
            assertThat(builder.build(SINGLE, "/users").get("status").asInt()).isEqualTo(422);
            assertThat(builder.status()).isEqualTo(422);
        }

        @Test
        @DisplayName("status is configurable")
        void status_isConfigurable() {
            assertThat(new ProblemDetailsBuilder(400).build(SINGLE, null).get("status").asInt())
                    .isEqualTo(400);
        }

        @Test
        @DisplayName("instance carries the request path, or null")
        void instance_isPathOrNull() {
            assertThat(builder.build(SINGLE, "/users").get("instance").asText()).isEqualTo("/users");
            assertThat(builder.build(SINGLE, null).get("instance").isNull()).isTrue();
        }
    }

    @Nested
    @DisplayName("Detail and issues")
    class Detail {

        @Test
        @DisplayName("single issue → 'path: message'")
        void detail_singleIssue() {
            assertThat(builder.build(SINGLE, null).get("detail").asText())
                    .isEqualTo("name: Expected string, received number");
        }

        @Test
        @DisplayName("several issues → count")
        void detail_multipleIssues() {
            assertThat(builder.build(MULTIPLE, null).get("detail").asText()).isEqualTo("2 validation issues");
        }

        @Test
        @DisplayName("issues array lists code, path and message")
        void issues_listed() {
            JsonNode issues = builder.build(MULTIPLE, null).get("issues");

            assertThat(issues.size()).isEqualTo(2);
            assertThat(issues.get(0).get("code").asText()).isEqualTo("required");
            assertThat(issues.get(0).get("path").get(0).asText()).isEqualTo("name");
            assertThat(issues.get(1).get("message").asText()).isEqualTo("Required");
        }
    }
}
