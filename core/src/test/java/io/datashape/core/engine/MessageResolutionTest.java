package io.datashape.core.engine;

import static io.datashape.core.schema.Schemas.field;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.object;
import static io.datashape.core.schema.Schemas.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import io.datashape.core.schema.Schema;
import io.datashape.core.spi.ErrorMap;
import io.datashape.core.spi.ErrorMap.ErrorMapContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Message resolution folds four layers, lowest first: built-in defaults, the global map, the
 * nearest schema-level map and the call-site map. A message carried by the issue payload wins over
 * all of them.
 */
@DisplayName("Message resolution")
class MessageResolutionTest {

    private GlobalConfig config;

    @BeforeEach
    void setUp() {
        config = GlobalConfig.create();
    }

    private String firstMessage(Schema<?> schema, Object input, ErrorMap callSite) {
        ParseOptions options =
                ParseOptions.builder().config(config).errorMap(callSite).build();
        return schema.safeParse(input, options).error().issues().get(0).message();
    }

    @Test
    void builtInDefault_whenNoMapIsSet() {
        assertThat(firstMessage(string(), 1, null)).isEqualTo("Expected string, received number");
    }

    @Test
    void globalMap_receivesBuiltInMessage() {
        ErrorMap global = mock(ErrorMap.class);
        when(global.message(any(), any())).thenReturn("global");
        config.setErrorMap(global);

        String message = firstMessage(string(), 1, null);

        ArgumentCaptor<ErrorMapContext> context = ArgumentCaptor.forClass(ErrorMapContext.class);
        verify(global).message(any(Issue.class), context.capture());
        assertThat(context.getValue().defaultMessage()).isEqualTo("Expected string, received number");
        assertThat(message).isEqualTo("global");
    }

    @Test
    void schemaMap_overridesGlobalAndSeesGlobalMessage() {
        config.setErrorMap((issue, ctx) -> "global");
        ErrorMap schemaMap = mock(ErrorMap.class);
        when(schemaMap.message(any(), any())).thenReturn("schema");

        String message = firstMessage(string().errorMap(schemaMap), 1, null);

        ArgumentCaptor<ErrorMapContext> context = ArgumentCaptor.forClass(ErrorMapContext.class);
        verify(schemaMap).message(any(Issue.class), context.capture());
        assertThat(context.getValue().defaultMessage()).isEqualTo("global");
        assertThat(message).isEqualTo("schema");
    }

    @Test
    void callSiteMap_overridesSchemaMap() {
        Schema<?> schema = string().errorMap((issue, ctx) -> "schema");

        assertThat(firstMessage(schema, 1, (issue, ctx) -> "call:" + ctx.defaultMessage()))
                .isEqualTo("call:schema");
    }

    @Test
    void nullFromLayer_keepsMessageBelow() {
        config.setErrorMap((issue, ctx) -> "global");

        assertThat(firstMessage(string(), 1, (issue, ctx) -> null)).isEqualTo("global");
        assertThat(firstMessage(string(), 1, (issue, ctx) -> "")).isEqualTo("global");
    }

    @Test
    void payloadMessage_winsOverEveryLayer() {
        config.setErrorMap((issue, ctx) -> "global");
        Schema<?> schema = number().refine(n -> n.intValue() > 0, "must be positive");

        assertThat(firstMessage(schema, -1, (issue, ctx) -> "call")).isEqualTo("must be positive");
    }

    @Test
    void checkMessage_winsOverEveryLayer() {
        Schema<?> schema = string().array().min(2, "need two");

        assertThat(firstMessage(schema, List.of("a"), (issue, ctx) -> "call")).isEqualTo("need two");
    }

    @Test
    void nearestAncestorSchemaMap_appliesToNestedFields() {
        Schema<?> schema = object(
                        field("outer", string()),
                        field("inner", object(field("zip", number())).errorMap((issue, ctx) -> "inner map")))
                .errorMap((issue, ctx) -> "outer map");

        var issues = schema.safeParse(Map.of("inner", Map.of()), ParseOptions.builder().config(config).build())
                .error()
                .issues();

        assertThat(issues).extracting(Issue::formattedPath).containsExactly("outer", "inner.zip");
        assertThat(issues).extracting(Issue::message).containsExactly("outer map", "inner map");
    }

    @Test
    void dictionaryMap_matchesByIssueKind() {
        config.setErrorMap(ErrorMap.fromDictionary(Map.of(IssueKind.REQUIRED.code(), "This field is required")));

        var issues = object(field("name", string()), field("age", number()))
                .safeParse(Map.of("age", "x"), ParseOptions.builder().config(config).build())
                .error()
                .issues();

        assertThat(issues).extracting(Issue::message)
                .containsExactly("This field is required", "Expected number, received string");
    }
}
