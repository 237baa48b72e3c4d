package com.querygen.model.validated;

import java.util.List;

import com.querygen.model.ModuleInfo;
import com.querygen.model.TypeAnnotation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A module whose queries all passed validation, ready for type resolution.
 */
@Value
@Builder
public class ValidatedModule {

    @NonNull
    ModuleInfo moduleInfo;

    @NonNull
    List<TypeAnnotation> paramTypes;

    @NonNull
    List<TypeAnnotation> rowTypes;

    @NonNull
    List<TypeAnnotation> dbTypes;

    @NonNull
    List<ValidatedQuery> queries;
}
