package io.datashape.core.engine;

import static io.datashape.core.schema.Schemas.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datashape.core.spi.IssueFormatter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobalConfig")
class GlobalConfigTest {

    private GlobalConfig config;

    @BeforeEach
    void setUp() {
        config = GlobalConfig.create();
    }

    @Test
    void freshInstanceHoldsDefaults() {
        assertThat(config.getOptions()).isEqualTo(GlobalOptions.DEFAULTS);
        assertThat(config.getErrorMap()).isNull();
        assertThat(config.getIssueFormatter()).isSameAs(DefaultIssueFormatter.INSTANCE);
    }

    @Test
    void createdInstancesAreIndependentOfShared() {
        config.updateOptions(o -> o.withDebug(true));

        assertThat(GlobalConfig.shared()).isNotSameAs(config);
        assertThat(GlobalConfig.shared().getOptions().debug()).isFalse();
    }

    @Test
    void setOptionsRejectsNull() {
        assertThatThrownBy(() -> config.setOptions(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void snapshotIsImmutableAcrossUpdates() {
        GlobalSettings before = config.snapshot();

        config.setOptions(new GlobalOptions(true, true));

        assertThat(before.options()).isEqualTo(GlobalOptions.DEFAULTS);
        assertThat(config.snapshot().options()).isEqualTo(new GlobalOptions(true, true));
    }

    @Test
    void nullFormatterRestoresDefault() {
        config.setIssueFormatter(issues -> "custom");
        config.setIssueFormatter(null);

        assertThat(config.getIssueFormatter()).isSameAs(DefaultIssueFormatter.INSTANCE);
    }

    @Test
    void formatterControlsExceptionMessage() {
        IssueFormatter formatter = issues -> issues.size() + " problem(s): " + issues.get(0).kind().code();
        config.setIssueFormatter(formatter);

        assertThatThrownBy(() -> string().parse(1, ParseOptions.builder().config(config).build()))
                .hasMessage("1 problem(s): invalid_type");
    }

    @Test
    void globalAbortEarlyAppliesToParses() {
        config.updateOptions(o -> o.withAbortEarly(true));
        var schema = string().array();
        var options = ParseOptions.builder().config(config).build();

        assertThat(schema.safeParse(List.of(1, 2), options).error().issues()).hasSize(1);
    }

    @Test
    void resetRestoresEverything() {
        config.setOptions(new GlobalOptions(true, true));
        config.setErrorMap((issue, ctx) -> "x");
        config.setIssueFormatter(issues -> "y");

        config.reset();

        assertThat(config.snapshot()).isEqualTo(GlobalSettings.defaults());
    }

    @Test
    void applyReplacesSnapshot() {
        GlobalSettings loaded =
                new GlobalSettings(new GlobalOptions(true, false), null, DefaultIssueFormatter.INSTANCE);

        config.apply(loaded);

        assertThat(config.snapshot()).isSameAs(loaded);
    }
}
