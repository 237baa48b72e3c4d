package com.querygen.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A bind parameter placeholder found in a query's SQL text.
 *
 * Either PostgreSQL-compatible ({@code $1}) or extended ({@code :name}).
 */
public abstract class BindParameter {

    private BindParameter() {
    }

    public abstract boolean isExtended();

    public static BindParameter pgCompatible(long index) {
        return new PgCompatible(index);
    }

    public static BindParameter extended(String name) {
        return new Extended(name);
    }

    /**
     * Indexed placeholder. The index is kept as parsed; narrowing happens during validation.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PgCompatible extends BindParameter {
        long index;

        @Override
        public boolean isExtended() {
            return false;
        }

        @Override
        public String toString() {
            return "$" + index;
        }
    }

    /**
     * Named placeholder.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Extended extends BindParameter {
        @NonNull
        String name;

        @Override
        public boolean isExtended() {
            return true;
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }
}
