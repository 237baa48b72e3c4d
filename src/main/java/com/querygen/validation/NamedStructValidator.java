package com.querygen.validation;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.querygen.model.ModuleInfo;
import com.querygen.model.NullableIdent;
import com.querygen.model.ResolvedField;
import com.querygen.model.SourceSpan;
import com.querygen.model.TypeAnnotation;
import com.querygen.validation.error.ValidationError;
import com.querygen.validation.exception.QueryValidationException;

/**
 * Registry checks for named structs, run by the type-resolution stage once a
 * named reference has been resolved against the live schema.
 */
public final class NamedStructValidator {

    private NamedStructValidator() {
    }

    /**
     * Looks a named struct up in one of the module's type registries.
     */
    public static List<SourceSpan<NullableIdent>> resolveNamedStruct(ModuleInfo moduleInfo,
                                                                     List<TypeAnnotation> registry,
                                                                     SourceSpan<String> name) {
        return registry.stream()
                .filter(type -> type.getName().getValue().equals(name.getValue()))
                .findFirst()
                .map(TypeAnnotation::getFields)
                .orElseThrow(() -> new QueryValidationException(
                        new ValidationError.UnknownNamedStruct(name.getStart()), moduleInfo));
    }

    /**
     * A named struct reused by several queries must resolve to the same fields,
     * in any order, every time. Repeated fields must repeat equally often.
     */
    public static void checkNamedStructConsistency(ModuleInfo moduleInfo,
                                                   SourceSpan<String> name,
                                                   List<ResolvedField> previousFields,
                                                   List<ResolvedField> fields) {
        boolean consistent = previousFields.size() == fields.size()
                && occurrences(previousFields).equals(occurrences(fields));
        if (!consistent) {
            throw new QueryValidationException(
                    new ValidationError.NamedStructInvalidFields(name, List.copyOf(previousFields), List.copyOf(fields)),
                    moduleInfo);
        }
    }

    private static Map<ResolvedField, Long> occurrences(List<ResolvedField> fields) {
        return fields.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }
}
