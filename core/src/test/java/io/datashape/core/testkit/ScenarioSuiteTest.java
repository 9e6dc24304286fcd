package io.datashape.core.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.datashape.core.engine.JsonValues;
import io.datashape.core.engine.ParseOptions;
import io.datashape.core.model.Issue;
import io.datashape.core.model.ParseResult;
import io.datashape.core.testkit.ScenarioLoader.ExpectedIssue;
import io.datashape.core.testkit.ScenarioLoader.ScenarioDefinition;
import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Parameterized scenario suite. Loads every scenario from {@code scenarios/validation-scenarios.yaml},
 * parses the input with the named schema from {@link SchemaCatalog} and compares the outcome.
 *
 * <p>Success scenarios compare the JSON rendering of the output with {@code expected_output}. Failure
 * scenarios compare the collected issues, in order, against {@code expected_issues}.
 */
@DisplayName("Scenario Suite")
class ScenarioSuiteTest {

    private static final String SCENARIOS = "scenarios/validation-scenarios.yaml";

    private static List<ScenarioDefinition> allScenarios;

    @BeforeAll
    static void loadScenarios() throws IOException {
        allScenarios = ScenarioLoader.loadAll(SCENARIOS);
        assertThat(allScenarios).as("Should load scenarios from " + SCENARIOS).isNotEmpty();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("successScenarios")
    @DisplayName("Accepted input")
    void acceptedInput(String displayName, ScenarioDefinition scenario) {
        ParseResult<?> result = run(scenario);

        assertThat(result.ok())
                .as("%s should pass but failed with %s", scenario.id(), result.error())
                .isTrue();
        assertThat(JsonValues.toJson(result.data())).isEqualTo(scenario.expectedOutput());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("failureScenarios")
    @DisplayName("Rejected input")
    void rejectedInput(String displayName, ScenarioDefinition scenario) {
        ParseResult<?> result = run(scenario);

        assertThat(result.ok()).as("%s should fail", scenario.id()).isFalse();
        List<Issue> issues = result.error().issues();
        assertThat(issues).hasSameSizeAs(scenario.expectedIssues());
        for (int i = 0; i < issues.size(); i++) {
            Issue actual = issues.get(i);
            ExpectedIssue expected = scenario.expectedIssues().get(i);
            assertThat(actual.kind().code()).as("code of issue %d", i).isEqualTo(expected.code());
            assertThat(JsonValues.toJson(actual.path())).as("path of issue %d", i).isEqualTo(expected.path());
            if (expected.message() != null) {
                assertThat(actual.message()).as("message of issue %d", i).isEqualTo(expected.message());
            }
        }
    }

    @Test
    @DisplayName("Every scenario names a registered schema")
    void everyScenarioNamesRegisteredSchema() {
        assertThat(SchemaCatalog.names())
                .containsAll(allScenarios.stream().map(ScenarioDefinition::schema).toList());
    }

    private static ParseResult<?> run(ScenarioDefinition scenario) {
        ParseOptions options = scenario.abortEarly() ? ParseOptions.stopAtFirstIssue() : ParseOptions.DEFAULT;
        JsonNode input = scenario.input();
        return SchemaCatalog.get(scenario.schema()).safeParse(input, options);
    }

    static Stream<Arguments> successScenarios() throws IOException {
        return scenarios(true);
    }

    static Stream<Arguments> failureScenarios() throws IOException {
        return scenarios(false);
    }

    private static Stream<Arguments> scenarios(boolean success) throws IOException {
        return ScenarioLoader.loadAll(SCENARIOS).stream()
                .filter(s -> s.isSuccessScenario() == success)
                .map(s -> Arguments.of(s.displayName(), s));
    }
}
