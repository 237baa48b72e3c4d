package com.querygen.normalize;

import java.util.List;

import com.querygen.model.QuerySql;
import com.querygen.model.SourceSpan;

/**
 * Rewrites the SQL of an extended-syntax query into what gets prepared against
 * the database.
 */
public interface SqlNormalizer {

    /**
     * @param sql            raw SQL and its bind parameters, in source order
     * @param sqlStartOffset byte offset of the SQL text in the module source
     * @param bindParams     distinct parameter names, in the order they will be bound
     */
    String normalize(QuerySql sql, int sqlStartOffset, List<SourceSpan<String>> bindParams);
}
