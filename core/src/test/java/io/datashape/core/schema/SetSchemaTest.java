package io.datashape.core.schema;

import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.set;
import static io.datashape.core.schema.Schemas.string;
import static org.assertj.core.api.Assertions.assertThat;

import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SetSchema")
class SetSchemaTest {

    private static Set<Object> setOf(Object... values) {
        return new LinkedHashSet<>(List.of(values));
    }

    @Test
    void validatesElementsPreservingOrder() {
        assertThat(set(string()).parse(setOf("b", "a"))).containsExactly("b", "a");
    }

    @Test
    void listInput_isInvalidType() {
        Issue issue = set(string()).safeParse(List.of("a")).error().issues().get(0);

        assertThat(issue.kind()).isEqualTo(IssueKind.INVALID_TYPE);
        assertThat(issue.message()).isEqualTo("Expected Set, received Array");
    }

    @Test
    void elementIssueAddressedByIterationIndex() {
        Issue issue = set(string()).safeParse(setOf("a", 2)).error().issues().get(0);

        assertThat(issue.path()).containsExactly(1);
    }

    @Test
    void sizeChecks_reportInvalidSet() {
        Issue issue = set(string()).min(2).safeParse(setOf("a")).error().issues().get(0);

        assertThat(issue.kind()).isEqualTo(IssueKind.INVALID_SET);
        assertThat(issue.message()).isEqualTo("Set must contain at least 2 element(s)");
        assertThat(set(string()).size(1).is(setOf("a"))).isTrue();
        assertThat(set(string()).max(1).is(setOf("a", "b"))).isFalse();
        assertThat(set(string()).nonempty().is(setOf())).isFalse();
    }

    @Test
    void exclusiveBounds() {
        SetSchema<String> between = set(string()).min(0, false, null).max(2, false, "At most one tag");

        assertThat(between.is(setOf())).isFalse();
        assertThat(between.is(setOf("a"))).isTrue();
        assertThat(between.safeParse(setOf("a", "b")).error().issues().get(0).message())
                .isEqualTo("At most one tag");
        assertThat(set(string()).min(1, false, null).safeParse(setOf("a")).error().issues().get(0).message())
                .isEqualTo("Set must contain more than 1 element(s)");
    }

    @Test
    void sortConversion() {
        assertThat(set(number()).ascending(true).parse(setOf(3, 1, 2))).containsExactly(1, 2, 3);
        assertThat(set(number()).descending(false).is(setOf(1, 2))).isFalse();
    }

    @Test
    void hint() {
        assertThat(set(number()).hint()).isEqualTo("Set<number>");
    }
}
