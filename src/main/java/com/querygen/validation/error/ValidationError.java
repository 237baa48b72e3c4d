package com.querygen.validation.error;

import java.util.List;

import com.querygen.model.NullableIdent;
import com.querygen.model.ResolvedField;
import com.querygen.model.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A single validation failure: its kind, the source position(s) it points at and
 * the minimal payload needed to render it.
 *
 * The set of subclasses is closed; add new kinds here and in {@link ValidationErrorVisitor}.
 */
public abstract class ValidationError {

    private ValidationError() {
    }

    public abstract ErrorKind getKind();

    public abstract <R> R accept(ValidationErrorVisitor<R> visitor);

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class AmbiguousBindParam extends ValidationError {
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.AMBIGUOUS_BIND_PARAM;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class InvalidI16Index extends ValidationError {
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.INVALID_I16_INDEX;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class DuplicateField extends ValidationError {
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.DUPLICATE_FIELD;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class TooManyBindParams extends ValidationError {
        int nbParams;
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.TOO_MANY_BIND_PARAMS;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class UnusedParam extends ValidationError {
        /** 1-based position of the parameter in its declaration list. */
        int index;
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.UNUSED_PARAM;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class InvalidNullableName extends ValidationError {
        @NonNull
        SourceSpan<NullableIdent> nullableIdent;
        /** True when the override targets a parameter rather than a row column. */
        boolean param;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.INVALID_NULLABLE_NAME;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class NamedStructInvalidFields extends ValidationError {
        @NonNull
        SourceSpan<String> name;
        @NonNull
        List<ResolvedField> expected;
        @NonNull
        List<ResolvedField> actual;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.NAMED_STRUCT_INVALID_FIELDS;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class DuplicateQueryName extends ValidationError {
        /** Earliest query whose name clashes, rendered first. */
        @NonNull
        SourceSpan<String> name;
        /** The later query carrying the same name. */
        @NonNull
        SourceSpan<String> otherName;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.DUPLICATE_QUERY_NAME;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class NamedStructInPgQuery extends ValidationError {
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.NAMED_STRUCT_IN_PG_QUERY;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class UnknownNamedStruct extends ValidationError {
        int pos;

        @Override
        public ErrorKind getKind() {
            return ErrorKind.UNKNOWN_NAMED_STRUCT;
        }

        @Override
        public <R> R accept(ValidationErrorVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
