package io.datashape.core.engine;

import io.datashape.core.model.Check;
import io.datashape.core.model.Issue;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.spi.ErrorMap;
import java.util.Locale;

/**
 * Built-in messages: the lowest error-map layer. Every issue kind has a message, and the switch
 * over kinds is exhaustive so a new kind cannot be added without one.
 */
public final class DefaultErrorMap implements ErrorMap {

    public static final DefaultErrorMap INSTANCE = new DefaultErrorMap();

    private DefaultErrorMap() {}

    @Override
    public String message(Issue issue, ErrorMapContext context) {
        IssuePayload payload = issue.payload();
        return switch (issue.kind()) {
            case REQUIRED -> "Required";
            case INVALID_TYPE -> {
                IssuePayload.InvalidType type = (IssuePayload.InvalidType) payload;
                yield "Expected " + type.expected().label() + ", received " + type.received().label();
            }
            case INVALID_ARRAY -> sizeMessage("Array", ((IssuePayload.CheckFailed) payload).check());
            case INVALID_SET -> sizeMessage("Set", ((IssuePayload.CheckFailed) payload).check());
            case INVALID_TUPLE -> sizeMessage("Tuple", ((IssuePayload.CheckFailed) payload).check());
            case INVALID_DATE -> dateMessage(((IssuePayload.CheckFailed) payload).check());
            case INVALID_ENUM_VALUE -> {
                IssuePayload.InvalidEnumValue value = (IssuePayload.InvalidEnumValue) payload;
                yield "Invalid enum value. Expected " + value.expectedFormatted() + ", received "
                        + value.receivedFormatted();
            }
            case INVALID_LITERAL -> {
                IssuePayload.InvalidLiteral literal = (IssuePayload.InvalidLiteral) payload;
                yield "Invalid literal value. Expected " + literal.expectedFormatted() + ", received "
                        + literal.receivedFormatted();
            }
            case INVALID_ARGUMENTS -> "Invalid function arguments";
            case INVALID_RETURN_TYPE -> "Invalid function return type";
            case INVALID_UNION -> "Invalid input";
            case INVALID_INTERSECTION -> "Intersection results could not be merged";
            case INVALID_INSTANCE -> "Expected an instance of " + ((IssuePayload.InvalidInstance) payload).className();
            case UNRECOGNIZED_KEYS -> "Unrecognized key(s) in object: "
                    + String.join(", ", ((IssuePayload.UnrecognizedKeys) payload).keys().stream()
                            .map(k -> "'" + k + "'")
                            .toList());
            case FORBIDDEN -> "Forbidden";
            case CUSTOM -> "Invalid input";
        };
    }

    private static String sizeMessage(String label, Check check) {
        if (check instanceof Check.Min<?> min) {
            return label + " must contain " + (min.inclusive() ? "at least " : "more than ") + min.value()
                    + " element(s)";
        }
        if (check instanceof Check.Max<?> max) {
            return label + " must contain " + (max.inclusive() ? "at most " : "fewer than ") + max.value()
                    + " element(s)";
        }
        if (check instanceof Check.Length length) {
            return label + " must contain exactly " + length.value() + " element(s)";
        }
        if (check instanceof Check.Size size) {
            return label + " must contain exactly " + size.value() + " element(s)";
        }
        if (check instanceof Check.Sort sort) {
            return label + " must be sorted in "
                    + (sort.direction() == Check.SortDirection.ASCENDING ? "ascending" : "descending") + " order";
        }
        return "Invalid " + label.toLowerCase(Locale.ROOT);
    }

    private static String dateMessage(Check check) {
        if (check instanceof Check.Min<?> min) {
            return "Date must be " + (min.inclusive() ? "greater than or equal to " : "greater than ") + min.value();
        }
        if (check instanceof Check.Max<?> max) {
            return "Date must be " + (max.inclusive() ? "smaller than or equal to " : "smaller than ") + max.value();
        }
        if (check instanceof Check.Range<?> range) {
            return "Date must be between " + range.min() + (range.inclusive().includesMin() ? " (inclusive)" : "")
                    + " and " + range.max() + (range.inclusive().includesMax() ? " (inclusive)" : "");
        }
        return "Invalid date";
    }
}
