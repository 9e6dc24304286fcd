package io.datashape.core.model;

import java.util.Locale;

/** Closed set of data-dependent failure kinds. */
public enum IssueKind {
    REQUIRED,
    INVALID_TYPE,
    INVALID_ARRAY,
    INVALID_DATE,
    INVALID_SET,
    INVALID_TUPLE,
    INVALID_ENUM_VALUE,
    INVALID_LITERAL,
    INVALID_ARGUMENTS,
    INVALID_RETURN_TYPE,
    INVALID_UNION,
    INVALID_INTERSECTION,
    INVALID_INSTANCE,
    UNRECOGNIZED_KEYS,
    FORBIDDEN,
    CUSTOM;

    private final String code = name().toLowerCase(Locale.ROOT);

    /** Wire code for this kind, e.g. {@code invalid_type}. Used as the key in dictionary error maps. */
    public String code() {
        return code;
    }

    /**
     * Resolves a kind from its wire code or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static IssueKind fromCode(String code) {
        for (IssueKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown issue kind: '" + code + "'");
    }
}
