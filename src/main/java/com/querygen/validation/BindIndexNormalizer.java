package com.querygen.validation;

import com.querygen.model.BindParameter;
import com.querygen.model.ModuleInfo;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Narrows parsed {@code $n} indices to the 16-bit range of the PostgreSQL wire
 * protocol. Parameters are 1-indexed, so {@code $0} is rejected as well.
 */
public final class BindIndexNormalizer {

    private BindIndexNormalizer() {
    }

    public static SourceSpan<Short> normalizeIndex(ModuleInfo moduleInfo, SourceSpan<BindParameter> bindParam) {
        if (!(bindParam.getValue() instanceof BindParameter.PgCompatible pgCompatible)) {
            throw new IllegalStateException("Expected an indexed bind parameter, got " + bindParam.getValue());
        }
        long index = pgCompatible.getIndex();
        if (index < 1 || index > Short.MAX_VALUE) {
            throw new QueryValidationException(new ValidationError.InvalidI16Index(bindParam.getStart()), moduleInfo);
        }
        return new SourceSpan<>(bindParam.getStart(), bindParam.getEnd(), (short) index);
    }
}
