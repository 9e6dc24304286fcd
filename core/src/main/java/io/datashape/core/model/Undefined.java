package io.datashape.core.model;

/**
 * Marker for an absent value. Distinct from {@code null}: a map key that is not present reads as
 * {@link #INSTANCE}, while a key mapped to {@code null} reads as {@code null}.
 *
 * <p>
 * Object schemas omit output keys whose parsed value is {@link #INSTANCE}, which is how optional
 * fields vanish from the result instead of appearing as explicit absent markers.
 */
public enum Undefined {
    INSTANCE;

    /** Returns {@code true} if the given value is the absent marker. */
    public static boolean is(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
