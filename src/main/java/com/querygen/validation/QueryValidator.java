package com.querygen.validation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.model.BindParameter;
import com.querygen.model.ModuleInfo;
import com.querygen.model.Query;
import com.querygen.model.QueryAnnotation;
import com.querygen.model.QueryDataStructure;
import com.querygen.model.SourceSpan;
import com.querygen.model.validated.ValidatedQuery;
import com.querygen.normalize.SqlNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Validates a single query and turns it into its dialect-specific validated form.
 *
 * Checks run in a fixed order and the first failure is thrown as a
 * {@link com.querygen.validation.exception.QueryValidationException}:
 * <ol>
 *   <li>duplicate fields in inline param/row lists</li>
 *   <li>mixed bind-parameter syntaxes</li>
 *   <li>extended: bind names are sorted and deduplicated, SQL is normalized</li>
 *   <li>indexed: indices narrowed to 16 bits, named structs rejected, then
 *       out-of-range and unused parameters</li>
 * </ol>
 */
@RequiredArgsConstructor
public class QueryValidator {

    private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

    private final SqlNormalizer sqlNormalizer;

    public ValidatedQuery validate(ModuleInfo moduleInfo, Query query) {
        QueryAnnotation annotation = query.getAnnotation();
        if (annotation.getParam() instanceof QueryDataStructure.Implicit implicit) {
            FieldUniquenessValidator.checkDuplicates(moduleInfo, implicit.getIdents());
        }
        if (annotation.getRow() instanceof QueryDataStructure.Implicit implicit) {
            FieldUniquenessValidator.checkDuplicates(moduleInfo, implicit.getIdents());
        }

        Dialect dialect = DialectResolver.resolve(moduleInfo, query.getSql().getBindParams());
        log.debug("Query {} uses {} bind parameters", annotation.getName().getValue(), dialect);

        return dialect == Dialect.EXTENDED
                ? validateExtended(query)
                : validatePgCompatible(moduleInfo, query);
    }

    private ValidatedQuery validateExtended(Query query) {
        List<SourceSpan<String>> names = new ArrayList<>();
        for (SourceSpan<BindParameter> bindParam : query.getSql().getBindParams()) {
            names.add(bindParam.map(QueryValidator::extendedName));
        }
        List<SourceSpan<String>> bindParams = sortedDistinct(names);
        String sqlText = sqlNormalizer.normalize(query.getSql(), query.getSqlStartOffset(), bindParams);

        QueryAnnotation annotation = query.getAnnotation();
        return new ValidatedQuery.Extended(
                annotation.getName(), annotation.getParam(), bindParams, annotation.getRow(), sqlText);
    }

    private ValidatedQuery validatePgCompatible(ModuleInfo moduleInfo, Query query) {
        List<SourceSpan<Short>> indices = new ArrayList<>();
        for (SourceSpan<BindParameter> bindParam : query.getSql().getBindParams()) {
            indices.add(BindIndexNormalizer.normalizeIndex(moduleInfo, bindParam));
        }
        List<SourceSpan<Short>> dedupedIndices = sortedDistinct(indices);

        ImplicitStructures structures = NamedStructGuard.guardPgCompatible(moduleInfo, query.getAnnotation());

        BindParamUsageValidator.checkOverflow(moduleInfo, structures.params(), dedupedIndices);
        BindParamUsageValidator.checkUnused(moduleInfo, structures.params(), indices);

        return new ValidatedQuery.PgCompatible(
                query.getName(), structures.params(), structures.row(), query.getSql().getSqlText());
    }

    private static String extendedName(BindParameter bindParam) {
        if (bindParam instanceof BindParameter.Extended extended) {
            return extended.getName();
        }
        throw new IllegalStateException("Indexed bind parameter in extended query: " + bindParam);
    }

    /**
     * Stable sort by value, keeping the first span of each distinct value.
     */
    static <T extends Comparable<T>> List<SourceSpan<T>> sortedDistinct(List<SourceSpan<T>> spans) {
        List<SourceSpan<T>> sorted = new ArrayList<>(spans);
        sorted.sort((a, b) -> a.getValue().compareTo(b.getValue()));

        List<SourceSpan<T>> distinct = new ArrayList<>();
        for (SourceSpan<T> span : sorted) {
            if (distinct.isEmpty() || !distinct.get(distinct.size() - 1).getValue().equals(span.getValue())) {
                distinct.add(span);
            }
        }
        return List.copyOf(distinct);
    }
}
