package io.datashape.core.engine;

import com.fasterxml.jackson.databind.node.TextNode;
import io.datashape.core.model.Undefined;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for working with untyped input values: copying, truthiness, equality, ordering and
 * message rendering.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class Values {

    private static final BigDecimal MAX = BigDecimal.valueOf(Double.MAX_VALUE).multiply(BigDecimal.TEN);

    private Values() {}

    /**
     * Deep-copies maps, lists, object arrays, sets and {@link Date}s so that a parse can never
     * mutate its caller's data. Immutable leaves and opaque objects are returned as-is.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>(Math.max(16, map.size() * 2));
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value instanceof Object[] array) {
            Object[] copy = new Object[array.length];
            for (int i = 0; i < array.length; i++) {
                copy[i] = deepCopy(array[i]);
            }
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value instanceof Date date) {
            return new Date(date.getTime());
        }
        return value;
    }

    /**
     * Truthiness of a refinement result.
     *
     * <ul>
     *   <li>{@code null}, {@link Undefined#INSTANCE} and {@code false} are falsy
     *   <li>zero and NaN are falsy
     *   <li>the empty string is falsy
     *   <li>anything else is truthy
     * </ul>
     */
    public static boolean isTruthy(Object value) {
        if (value == null || value == Undefined.INSTANCE) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof BigInteger big) {
            return big.signum() != 0;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return true;
    }

    /**
     * Equality for literal and enum matching. Numbers compare by numeric value regardless of boxed
     * type; NaN never equals anything.
     */
    public static boolean primitiveEquals(Object a, Object b) {
        if (a instanceof BigInteger || b instanceof BigInteger) {
            return Objects.equals(a, b);
        }
        if (a instanceof Number x && b instanceof Number y) {
            if (isNaN(x) || isNaN(y)) {
                return false;
            }
            return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    public static boolean isNaN(Object value) {
        return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    /** Renders a primitive for use in messages: strings are quoted, bigints carry an {@code n} suffix. */
    public static String literalize(Object value) {
        if (value instanceof String s) {
            return TextNode.valueOf(s).toString();
        }
        if (value instanceof BigInteger big) {
            return big + "n";
        }
        return String.valueOf(value);
    }

    /** Joins rendered primitives with {@code " | "}. */
    public static String literalizeAll(Collection<?> values) {
        List<String> parts = new ArrayList<>(values.size());
        values.forEach(v -> parts.add(literalize(v)));
        return String.join(" | ", parts);
    }

    /**
     * Total order used by sort checks. Values are ranked first: {@code null}, then numbers, then NaN,
     * then other comparable values grouped by class, then everything else. Numbers compare
     * numerically, comparable values of one class compare naturally, and the rest compare by class
     * name and string form.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        int rank = Integer.compare(sortRank(a), sortRank(b));
        if (rank != 0) {
            return rank;
        }
        if (a == null || (isNaN(a) && isNaN(b))) {
            return 0;
        }
        if (a instanceof Number x && !isNaN(x)) {
            return toBigDecimal(x).compareTo(toBigDecimal((Number) b));
        }
        int byClass = a.getClass().getName().compareTo(b.getClass().getName());
        if (byClass != 0) {
            return byClass;
        }
        if (a instanceof Comparable ca) {
            return ca.compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static int sortRank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return isNaN(value) ? 2 : 1;
        }
        return value instanceof Comparable ? 3 : 4;
    }

    /** Views a list or object array as a list. */
    public static List<Object> asList(Object value) {
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        @SuppressWarnings("unchecked")
        List<Object> list = (List<Object>) value;
        return list;
    }

    /** Normalizes a {@link Date} or {@link Instant} to an instant. */
    public static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return (Instant) value;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isInfinite(d)) {
                return d > 0 ? MAX : MAX.negate();
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
