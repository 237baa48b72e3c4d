package com.querygen.normalize;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.querygen.model.BindParameter;
import com.querygen.model.QuerySql;
import com.querygen.model.SourceSpan;

/**
 * Replaces every {@code :name} placeholder with {@code $k}, where {@code k} is the
 * 1-based position of {@code name} in the bind order.
 *
 * Placeholder spans cover the whole token, sigil included, with an exclusive end.
 */
public class PlaceholderSqlNormalizer implements SqlNormalizer {

    @Override
    public String normalize(QuerySql sql, int sqlStartOffset, List<SourceSpan<String>> bindParams) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < bindParams.size(); i++) {
            positions.putIfAbsent(bindParams.get(i).getValue(), i + 1);
        }

        byte[] source = sql.getSqlText().getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(source.length);
        int cursor = 0;

        for (SourceSpan<BindParameter> placeholder : sql.getBindParams()) {
            if (!(placeholder.getValue() instanceof BindParameter.Extended extended)) {
                throw new IllegalArgumentException("Indexed placeholder in extended query: " + placeholder.getValue());
            }
            Integer position = positions.get(extended.getName());
            if (position == null) {
                throw new IllegalArgumentException("No bind position for :" + extended.getName());
            }

            int start = placeholder.getStart() - sqlStartOffset;
            int end = placeholder.getEnd() - sqlStartOffset;
            if (start < cursor || end > source.length) {
                throw new IllegalArgumentException("Placeholder :" + extended.getName()
                        + " at [" + placeholder.getStart() + ", " + placeholder.getEnd() + ") is outside the query text");
            }

            out.write(source, cursor, start - cursor);
            byte[] replacement = ("$" + position).getBytes(StandardCharsets.UTF_8);
            out.write(replacement, 0, replacement.length);
            cursor = end;
        }
        out.write(source, cursor, source.length - cursor);

        return out.toString(StandardCharsets.UTF_8);
    }
}
