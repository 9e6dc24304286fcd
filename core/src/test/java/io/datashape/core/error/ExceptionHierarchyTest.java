package io.datashape.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.datashape.core.engine.DefaultIssueFormatter;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, one concrete type per failure phase. */
class ExceptionHierarchyTest {

    @Test
    void dataShapeExceptionIsAbstractAndRoot() {
        assertThat(DataShapeException.class).isAbstract();
        assertThat(DataShapeException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void schemaDefinitionExceptionBelongsToDefinitionPhase() {
        var cause = new IllegalStateException("boom");
        var ex = new SchemaDefinitionException("union needs two members", cause);

        assertThat(ex).isInstanceOf(DataShapeException.class);
        assertThat(ex.phase()).isEqualTo(DataShapeException.Phase.DEFINITION);
        assertThat(ex.detail()).isEqualTo("union needs two members");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void asyncUsageExceptionBelongsToParsePhase() {
        var ex = new AsyncUsageException();

        assertThat(ex.phase()).isEqualTo(DataShapeException.Phase.PARSE);
        assertThat(ex.getMessage()).isEqualTo(AsyncUsageException.DEFAULT_MESSAGE);
        assertThat(new AsyncUsageException("custom").detail()).isEqualTo("custom");
    }

    @Test
    void configLoadExceptionCarriesSource() {
        var ex = new ConfigLoadException("bad yaml", "/etc/datashape.yaml");

        assertThat(ex.phase()).isEqualTo(DataShapeException.Phase.CONFIGURATION);
        assertThat(ex.source()).isEqualTo("/etc/datashape.yaml");
    }

    @Test
    void validationExceptionBelongsToParsePhase() {
        var ex = new ValidationException(List.of(), DefaultIssueFormatter.INSTANCE);

        assertThat(ex).isInstanceOf(DataShapeException.class);
        assertThat(ex.phase()).isEqualTo(DataShapeException.Phase.PARSE);
        assertThat(ex.isEmpty()).isTrue();
        assertThat(ex.getMessage()).isEqualTo("Validation failed");
    }
}
