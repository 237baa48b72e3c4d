package com.querygen.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.model.ModuleInfo;
import com.querygen.model.ParsedModule;
import com.querygen.model.Query;
import com.querygen.model.TypeAnnotation;
import com.querygen.model.validated.ValidatedModule;
import com.querygen.model.validated.ValidatedQuery;
import com.querygen.normalize.PlaceholderSqlNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Validates a whole parsed module: query name uniqueness, the field lists of
 * every declared type, then every query in declaration order.
 *
 * Fails fast; the first {@link com.querygen.validation.exception.QueryValidationException}
 * aborts the module.
 */
@RequiredArgsConstructor
public class ModuleValidator {

    private static final Logger log = LoggerFactory.getLogger(ModuleValidator.class);

    private final QueryValidator queryValidator;

    public ModuleValidator() {
        this(new QueryValidator(new PlaceholderSqlNormalizer()));
    }

    public ValidatedModule validate(ModuleInfo moduleInfo, ParsedModule module) {
        QueryNameValidator.checkNameCollisions(moduleInfo, module.getQueries());

        Stream.of(module.getParamTypes(), module.getRowTypes(), module.getDbTypes())
                .flatMap(List::stream)
                .map(TypeAnnotation::getFields)
                .forEach(fields -> FieldUniquenessValidator.checkDuplicates(moduleInfo, fields));

        List<ValidatedQuery> queries = new ArrayList<>();
        for (Query query : module.getQueries()) {
            queries.add(queryValidator.validate(moduleInfo, query));
        }
        log.debug("Validated {} queries in {}", queries.size(), moduleInfo.getPath());

        return ValidatedModule.builder()
                .moduleInfo(moduleInfo)
                .paramTypes(module.getParamTypes())
                .rowTypes(module.getRowTypes())
                .dbTypes(module.getDbTypes())
                .queries(List.copyOf(queries))
                .build();
    }
}
