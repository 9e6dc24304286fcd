package io.datashape.core.schema;

import static io.datashape.core.schema.Schemas.field;
import static io.datashape.core.schema.Schemas.intersection;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.object;
import static io.datashape.core.schema.Schemas.string;
import static org.assertj.core.api.Assertions.assertThat;

import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.ParseResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IntersectionSchema")
class IntersectionSchemaTest {

    private final ObjectSchema named = object(field("name", string()));
    private final ObjectSchema aged = object(field("age", number()));

    @Test
    @SuppressWarnings("unchecked")
    void objectOutputsMergeKeyWise() {
        Object merged = intersection(named, aged).parse(Map.of("name", "Ada", "age", 36, "extra", 1));

        assertThat((Map<String, Object>) merged)
                .containsOnlyKeys("name", "age")
                .containsEntry("name", "Ada")
                .containsEntry("age", 36);
    }

    @Test
    void andBuildsTwoMemberIntersection() {
        IntersectionSchema schema = named.and(aged);

        assertThat(schema.members()).hasSize(2);
        assertThat(schema.hint()).isEqualTo("{ name: string } & { age: number }");
    }

    @Test
    void memberIssuesAreReportedDirectly() {
        ParseResult<Object> result = intersection(named, aged).safeParse(Map.of("name", 1));

        assertThat(result.error().issues())
                .extracting(Issue::path)
                .containsExactly(List.of("name"), List.of("age"));
    }

    @Test
    @DisplayName("irreconcilable shared key → exactly one InvalidIntersection issue")
    void irreconcilableOutputs_reportSingleIssue() {
        ObjectSchema lengthOfName = object(field("name", string().transform(String::length)));

        ParseResult<Object> result = intersection(named, lengthOfName).safeParse(Map.of("name", "Ada"));

        assertThat(result.error().issues()).hasSize(1);
        Issue issue = result.error().issues().get(0);
        assertThat(issue.kind()).isEqualTo(IssueKind.INVALID_INTERSECTION);
        assertThat(issue.message()).isEqualTo("Intersection results could not be merged");
    }

    @Test
    void sameTypedPrimitivesKeepLeftValue() {
        Object result = intersection(string(), string().transform(s -> s.toUpperCase())).parse("abc");

        assertThat(result).isEqualTo("abc");
    }

    @Test
    void asyncParseFoldsInDeclaredOrder() {
        Object result = intersection(string(), string().transform(s -> s.toUpperCase()))
                .parseAsync("abc")
                .join();

        assertThat(result).isEqualTo("abc");
    }
}
