package com.querygen.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.querygen.model.ModuleInfo;
import com.querygen.model.ResolvedField;
import com.querygen.model.SourceSpan;

/**
 * Fields seen so far for each named struct of a module.
 *
 * Immutable: {@link #record} returns the map to use for the next query, leaving
 * this one untouched.
 */
public final class NamedStructUsages {

    private static final NamedStructUsages EMPTY = new NamedStructUsages(Map.of());

    private final Map<String, List<ResolvedField>> fieldsByName;

    private NamedStructUsages(Map<String, List<ResolvedField>> fieldsByName) {
        this.fieldsByName = fieldsByName;
    }

    public static NamedStructUsages empty() {
        return EMPTY;
    }

    /**
     * Registers the first use of a named struct, or checks a later use against it.
     */
    public NamedStructUsages record(ModuleInfo moduleInfo, SourceSpan<String> name, List<ResolvedField> fields) {
        List<ResolvedField> previous = fieldsByName.get(name.getValue());
        if (previous != null) {
            NamedStructValidator.checkNamedStructConsistency(moduleInfo, name, previous, fields);
            return this;
        }
        Map<String, List<ResolvedField>> next = new LinkedHashMap<>(fieldsByName);
        next.put(name.getValue(), List.copyOf(fields));
        return new NamedStructUsages(Collections.unmodifiableMap(next));
    }

    public Optional<List<ResolvedField>> fieldsOf(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public int size() {
        return fieldsByName.size();
    }
}
