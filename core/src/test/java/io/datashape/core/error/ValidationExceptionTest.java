package io.datashape.core.error;

import static io.datashape.core.schema.Schemas.field;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.object;
import static io.datashape.core.schema.Schemas.string;
import static io.datashape.core.schema.Schemas.union;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.datashape.core.model.IssueKind;
import io.datashape.core.schema.ObjectSchema;
import io.datashape.core.schema.Schema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ValidationException")
class ValidationExceptionTest {

    private static final ObjectSchema USER = object(
            field("name", string()),
            field("address", object(field("city", string()), field("zip", number()))),
            field("tags", string().array()));

    private static ValidationException failure(Object input) {
        return USER.safeParse(input).error();
    }

    private static final Map<String, Object> BAD_INPUT = Map.of(
            "name", 42,
            "address", Map.of("city", "Oslo"),
            "tags", List.of("a", 7));

    @Test
    void issuesKeepReportOrder() {
        ValidationException ex = failure(BAD_INPUT);

        assertThat(ex.issues())
                .extracting(issue -> issue.formattedPath())
                .containsExactly("name", "address.zip", "tags[1]");
        assertThat(ex.issues())
                .extracting(issue -> issue.kind())
                .containsExactly(IssueKind.INVALID_TYPE, IssueKind.REQUIRED, IssueKind.INVALID_TYPE);
    }

    @Test
    void messageListsEveryIssue() {
        String message = failure(BAD_INPUT).getMessage();

        assertThat(message)
                .startsWith("3 validation issues")
                .contains("[name] Expected string, received number (invalid_type)")
                .contains("[address.zip] Required (required)")
                .contains("[tags[1]] Expected string, received number (invalid_type)");
    }

    @Nested
    @DisplayName("format")
    class Format {

        @Test
        void buildsTreeMirroringInput() {
            FormattedErrors tree = failure(BAD_INPUT).format();

            assertThat(tree.errors()).isEmpty();
            assertThat(tree.get("name").errors()).containsExactly("Expected string, received number");
            assertThat(tree.get("address").get("zip").errors()).containsExactly("Required");
            assertThat(tree.get("tags").get(1).errors()).containsExactly("Expected string, received number");
            assertThat(tree.get("missing")).isNull();
        }

        @Test
        void customMapperIsApplied() {
            FormattedErrors tree = failure(BAD_INPUT).format(issue -> issue.kind().code());

            assertThat(tree.get("address").get("zip").errors()).containsExactly("required");
        }

        @Test
        void rootIssuesLandInRootErrors() {
            FormattedErrors tree = failure("not an object").format();

            assertThat(tree.errors()).containsExactly("Expected object, received string");
            assertThat(tree.children()).isEmpty();
        }

        @Test
        void unionIssuesAreExpanded() {
            ValidationException ex = union(string(), number()).safeParse(true).error();

            FormattedErrors tree = ex.format();

            assertThat(ex.issues()).hasSize(1);
            assertThat(tree.errors())
                    .containsExactly("Expected string, received boolean", "Expected number, received boolean");
        }

        @Test
        void toJsonUsesErrorsKey() {
            JsonNode json = failure(BAD_INPUT).format().toJson();

            assertThat(json.get("_errors").isArray()).isTrue();
            assertThat(json.at("/address/zip/_errors/0").asText()).isEqualTo("Required");
            assertThat(json.at("/tags/1/_errors/0").asText()).isEqualTo("Expected string, received number");
        }
    }

    @Nested
    @DisplayName("flatten")
    class Flatten {

        @Test
        void groupsByFirstPathSegment() {
            FlattenedErrors flat = failure(BAD_INPUT).flatten();

            assertThat(flat.formErrors()).isEmpty();
            assertThat(flat.fieldErrors()).containsOnlyKeys("name", "address", "tags");
            assertThat(flat.fieldErrors().get("address")).containsExactly("Required");
        }

        @Test
        @DisplayName("field errors keep the order the issues were reported in")
        void fieldErrorsKeepReportOrder() {
            Map<String, Schema<?>> shape = new LinkedHashMap<>();
            List<String> names = new ArrayList<>();
            for (int i = 12; i > 0; i--) {
                names.add("field" + i);
                shape.put("field" + i, string());
            }

            FlattenedErrors flat = object(shape).safeParse(Map.of()).error().flatten();

            assertThat(flat.fieldErrors().keySet()).containsExactlyElementsOf(names);
        }

        @Test
        void rootIssuesBecomeFormErrors() {
            FlattenedErrors flat = failure(null).flatten(issue -> issue.kind().code());

            assertThat(flat.formErrors()).containsExactly("invalid_type");
            assertThat(flat.fieldErrors()).isEmpty();
        }
    }

    @Test
    void toJsonRendersCodePathAndMessage() {
        JsonNode json = failure(BAD_INPUT).toJson();

        assertThat(json.isArray()).isTrue();
        assertThat(json.size()).isEqualTo(3);
        assertThat(json.get(2).get("code").asText()).isEqualTo("invalid_type");
        assertThat(json.get(2).get("path").get(0).asText()).isEqualTo("tags");
        assertThat(json.get(2).get("path").get(1).isInt()).isTrue();
        assertThat(json.get(2).get("path").get(1).asInt()).isEqualTo(1);
    }
}
