package com.querygen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Raw SQL body of a query and the bind parameters found in it, in source order.
 */
@Value
@Builder(toBuilder = true)
public class QuerySql {

    @NonNull
    @Singular
    List<SourceSpan<BindParameter>> bindParams;

    @NonNull
    String sqlText;
}
