package io.datashape.core.engine;

import io.datashape.core.spi.ErrorMap;
import io.datashape.core.spi.IssueFormatter;
import java.util.Objects;

/**
 * Immutable snapshot of the global configuration. A parse captures one snapshot when it starts and
 * uses it throughout, so concurrent reconfiguration never affects a parse in flight.
 *
 * @param options        parse defaults
 * @param errorMap       global error map layer, or {@code null}
 * @param issueFormatter formatter for validation exception messages
 */
public record GlobalSettings(GlobalOptions options, ErrorMap errorMap, IssueFormatter issueFormatter) {

    public GlobalSettings {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(issueFormatter, "issueFormatter must not be null");
    }

    public static GlobalSettings defaults() {
        return new GlobalSettings(GlobalOptions.DEFAULTS, null, DefaultIssueFormatter.INSTANCE);
    }
}
