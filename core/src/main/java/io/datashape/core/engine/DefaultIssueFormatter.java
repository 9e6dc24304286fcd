package io.datashape.core.engine;

import io.datashape.core.model.Issue;
import io.datashape.core.spi.IssueFormatter;
import java.util.List;

/**
 * Renders one line per issue: {@code [path] message (code)}. Root-level issues omit the path.
 */
public final class DefaultIssueFormatter implements IssueFormatter {

    public static final DefaultIssueFormatter INSTANCE = new DefaultIssueFormatter();

    private DefaultIssueFormatter() {}

    @Override
    public String format(List<Issue> issues) {
        if (issues.isEmpty()) {
            return "Validation failed";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(issues.size() == 1 ? "1 validation issue" : issues.size() + " validation issues");
        for (Issue issue : issues) {
            sb.append(System.lineSeparator()).append("  - ");
            String path = issue.formattedPath();
            if (!path.isEmpty()) {
                sb.append('[').append(path).append("] ");
            }
            sb.append(issue.message()).append(" (").append(issue.kind().code()).append(')');
        }
        return sb.toString();
    }
}
