package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Values;
import io.datashape.core.model.Check;
import io.datashape.core.model.IssueKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/** Check evaluation shared by array and set nodes. */
final class SizedChecks {

    static final Set<String> SIZE_BOUNDS = Set.of("min", "max");
    static final Set<String> EXACT_SIZE = Set.of("len", "size");

    private SizedChecks() {}

    static Set<String> opposingSort(Check.SortDirection direction) {
        return Set.of(direction == Check.SortDirection.ASCENDING ? "sort_descending" : "sort_ascending");
    }

    /**
     * Runs {@code checks} in order against {@code items}, reporting failures as {@code kind}.
     * Converting sort checks rewrite the items and the context data to the sorted order.
     *
     * @return the items after any sort conversion
     */
    static List<Object> apply(ParseContext ctx, IssueKind kind, List<Check> checks, List<Object> items) {
        List<Object> current = items;
        for (Check check : checks) {
            boolean passed = true;
            int size = current.size();
            if (check instanceof Check.Min<?> min) {
                int bound = (Integer) min.value();
                passed = min.inclusive() ? size >= bound : size > bound;
            } else if (check instanceof Check.Max<?> max) {
                int bound = (Integer) max.value();
                passed = max.inclusive() ? size <= bound : size < bound;
            } else if (check instanceof Check.Length length) {
                passed = size == length.value();
            } else if (check instanceof Check.Size exact) {
                passed = size == exact.value();
            } else if (check instanceof Check.Sort sort) {
                List<Object> sorted = sorted(current, sort.direction());
                if (!sorted.equals(current)) {
                    if (sort.convert()) {
                        current = sorted;
                        ctx.setData(sorted);
                    } else {
                        passed = false;
                    }
                }
            }
            if (!passed) {
                ctx.checkFailed(kind, check);
                if (ctx.abortEarly()) {
                    return current;
                }
            }
        }
        return current;
    }

    private static List<Object> sorted(List<Object> items, Check.SortDirection direction) {
        List<Object> sorted = new ArrayList<>(items);
        sorted.sort(Values::compare);
        if (direction == Check.SortDirection.DESCENDING) {
            Collections.reverse(sorted);
        }
        return sorted;
    }
}
