package com.querygen.validation;

import java.util.List;

import com.querygen.model.NullableIdent;
import com.querygen.model.SourceSpan;

/**
 * Inline param and row lists of a query known to use no named struct.
 */
public record ImplicitStructures(
        List<SourceSpan<NullableIdent>> params,
        List<SourceSpan<NullableIdent>> row) {
}
