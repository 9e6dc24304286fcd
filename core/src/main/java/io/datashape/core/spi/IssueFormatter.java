package io.datashape.core.spi;

import io.datashape.core.model.Issue;
import java.util.List;

/**
 * Renders a list of issues into the message of a {@link io.datashape.core.error.ValidationException}.
 * Registered globally through {@code GlobalConfig.setIssueFormatter}.
 */
@FunctionalInterface
public interface IssueFormatter {

    String format(List<Issue> issues);
}
