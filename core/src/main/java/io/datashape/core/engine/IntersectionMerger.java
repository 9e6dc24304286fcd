package io.datashape.core.engine;

import io.datashape.core.model.ParsedType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles the outputs of intersection members.
 *
 * <ul>
 *   <li>keyed objects merge key-wise: the left side's keys first, shared keys merged recursively
 *   <li>arrays of equal length merge element-wise
 *   <li>dates merge only when they denote the same instant
 *   <li>any other pair of values of the same classified type keeps the left value
 *   <li>values of different classified types cannot be merged
 * </ul>
 */
public final class IntersectionMerger {

    private IntersectionMerger() {}

    /** Outcome of a merge; {@code data} is only meaningful when {@code valid}. */
    public record Merged(boolean valid, Object data) {

        static final Merged INVALID = new Merged(false, null);
    }

    public static Merged merge(Object a, Object b) {
        ParsedType left = ParsedType.of(a);
        ParsedType right = ParsedType.of(b);
        if (left != right) {
            return Merged.INVALID;
        }
        return switch (left) {
            case OBJECT -> mergeObjects((Map<?, ?>) a, (Map<?, ?>) b);
            case ARRAY -> mergeArrays(Values.asList(a), Values.asList(b));
            case DATE -> Values.toInstant(a).equals(Values.toInstant(b)) ? new Merged(true, a) : Merged.INVALID;
            default -> new Merged(true, a);
        };
    }

    private static Merged mergeObjects(Map<?, ?> a, Map<?, ?> b) {
        Map<Object, Object> merged = new LinkedHashMap<>(a);
        for (Map.Entry<?, ?> entry : b.entrySet()) {
            Object key = entry.getKey();
            if (!a.containsKey(key)) {
                merged.put(key, entry.getValue());
                continue;
            }
            Merged value = merge(a.get(key), entry.getValue());
            if (!value.valid()) {
                return Merged.INVALID;
            }
            merged.put(key, value.data());
        }
        return new Merged(true, merged);
    }

    private static Merged mergeArrays(List<Object> a, List<Object> b) {
        if (a.size() != b.size()) {
            return Merged.INVALID;
        }
        List<Object> merged = new ArrayList<>(a.size());
        for (int i = 0; i < a.size(); i++) {
            Merged element = merge(a.get(i), b.get(i));
            if (!element.valid()) {
                return Merged.INVALID;
            }
            merged.add(element.data());
        }
        return new Merged(true, merged);
    }
}
