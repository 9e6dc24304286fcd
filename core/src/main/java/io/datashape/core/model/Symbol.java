package io.datashape.core.model;

/**
 * Unique, identity-compared token. Two symbols are never equal unless they are the same instance,
 * regardless of their description.
 */
public final class Symbol {

    private final String description;

    private Symbol(String description) {
        this.description = description;
    }

    /** Creates a new unique symbol with the given (optional) description. */
    public static Symbol of(String description) {
        return new Symbol(description);
    }

    /** The description supplied at creation, or {@code null}. */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description != null ? "Symbol(" + description + ")" : "Symbol()";
    }
}
