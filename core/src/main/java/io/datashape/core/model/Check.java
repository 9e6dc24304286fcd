package io.datashape.core.model;

import io.datashape.core.error.SchemaDefinitionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative check attached to a sized container or date node. Checks are immutable; the failing
 * check becomes the payload of the issue it produces, and its {@link #message()} takes priority
 * over every error map.
 */
public sealed interface Check {

    /** Check kind, e.g. {@code min}, {@code len} or {@code sort_ascending}. */
    String kind();

    /** Message supplied when the check was declared, or {@code null}. */
    String message();

    /**
     * Returns a new check list with {@code added} appended, after removing any check of the same
     * kind and every check whose kind is in {@code cleared}.
     */
    static List<Check> add(List<Check> checks, Check added, Set<String> cleared) {
        List<Check> next = new ArrayList<>(checks.size() + 1);
        for (Check check : checks) {
            if (!check.kind().equals(added.kind()) && !cleared.contains(check.kind())) {
                next.add(check);
            }
        }
        next.add(added);
        return List.copyOf(next);
    }

    /** Fails with {@link SchemaDefinitionException} unless {@code value} is a non-negative size. */
    static int requireSize(int value, String label) {
        if (value < 0) {
            throw new SchemaDefinitionException(label + " must be a non-negative integer; got " + value);
        }
        return value;
    }

    /** Lower bound. */
    record Min<V>(V value, boolean inclusive, String message) implements Check {
        public Min {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "min";
        }
    }

    /** Upper bound. */
    record Max<V>(V value, boolean inclusive, String message) implements Check {
        public Max {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "max";
        }
    }

    /** Exact element count for arrays. */
    record Length(int value, String message) implements Check {
        @Override
        public String kind() {
            return "len";
        }
    }

    /** Exact element count for sets. */
    record Size(int value, String message) implements Check {
        @Override
        public String kind() {
            return "size";
        }
    }

    /** Two-sided bound with per-side inclusivity. */
    record Range<V>(V min, V max, RangeInclusive inclusive, String message) implements Check {
        public Range {
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
            inclusive = inclusive != null ? inclusive : RangeInclusive.BOTH;
        }

        @Override
        public String kind() {
            return "range";
        }
    }

    /**
     * Sort order requirement. With {@code convert} the collection is rewritten to the sorted order
     * instead of failing.
     */
    record Sort(SortDirection direction, boolean convert, String message) implements Check {
        public Sort {
            Objects.requireNonNull(direction, "direction must not be null");
        }

        @Override
        public String kind() {
            return direction == SortDirection.ASCENDING ? "sort_ascending" : "sort_descending";
        }
    }

    /** Which ends of a {@link Range} are inclusive. */
    enum RangeInclusive {
        MIN,
        MAX,
        BOTH,
        NONE;

        public boolean includesMin() {
            return this == MIN || this == BOTH;
        }

        public boolean includesMax() {
            return this == MAX || this == BOTH;
        }
    }

    enum SortDirection {
        ASCENDING,
        DESCENDING
    }
}
