package com.querygen.validation;

/**
 * Bind-parameter syntax used by a query.
 */
public enum Dialect {
    /** Indexed placeholders: {@code $1, $2}. */
    PG_COMPATIBLE,
    /** Named placeholders: {@code :id, :name}. */
    EXTENDED
}
