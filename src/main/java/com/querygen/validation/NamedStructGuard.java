package com.querygen.validation;

import java.util.List;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.QueryAnnotation;
import com.querygen.model.QueryDataStructure;
import com.querygen.model.SourceSpan;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Named structs are only allowed with the extended syntax, since indexed
 * parameters are bound by position rather than by field name.
 */
public final class NamedStructGuard {

    private NamedStructGuard() {
    }

    public static ImplicitStructures guardPgCompatible(ModuleInfo moduleInfo, QueryAnnotation annotation) {
        rejectNamed(moduleInfo, annotation.getParam());
        rejectNamed(moduleInfo, annotation.getRow());
        return new ImplicitStructures(idents(annotation.getParam()), idents(annotation.getRow()));
    }

    private static void rejectNamed(ModuleInfo moduleInfo, QueryDataStructure structure) {
        if (structure instanceof QueryDataStructure.Named named) {
            throw new QueryValidationException(
                    new ValidationError.NamedStructInPgQuery(named.getName().getStart()), moduleInfo);
        }
    }

    private static List<SourceSpan<NullableIdent>> idents(QueryDataStructure structure) {
        if (structure instanceof QueryDataStructure.Implicit implicit) {
            return implicit.getIdents();
        }
        throw new IllegalStateException("Named struct left in a PostgreSQL-compatible query: " + structure);
    }
}
