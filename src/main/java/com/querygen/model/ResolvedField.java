package com.querygen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A struct field after its type has been resolved against the live schema.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedField {

    @NonNull
    String name;

    @NonNull
    String type;

    boolean nullable;

    boolean innerNullable;

    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(": ").append(type);
        if (innerNullable) {
            sb.append("[]?");
        }
        if (nullable) {
            sb.append('?');
        }
        return sb.toString();
    }
}
