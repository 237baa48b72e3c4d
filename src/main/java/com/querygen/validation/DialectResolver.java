package com.querygen.validation;

import java.util.List;

import com.querygen.model.BindParameter;
import com.querygen.model.ModuleInfo;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Decides which bind-parameter dialect a query uses.
 *
 * The first bind parameter sets the dialect; a query without bind parameters is
 * treated as extended. Every other parameter must use the same syntax.
 */
public final class DialectResolver {

    private DialectResolver() {
    }

    public static Dialect resolve(ModuleInfo moduleInfo, List<SourceSpan<BindParameter>> bindParams) {
        boolean extended = bindParams.isEmpty() || bindParams.get(0).getValue().isExtended();
        for (SourceSpan<BindParameter> bindParam : bindParams) {
            if (bindParam.getValue().isExtended() != extended) {
                throw new QueryValidationException(
                        new ValidationError.AmbiguousBindParam(bindParam.getStart()), moduleInfo);
            }
        }
        return extended ? Dialect.EXTENDED : Dialect.PG_COMPATIBLE;
    }
}
