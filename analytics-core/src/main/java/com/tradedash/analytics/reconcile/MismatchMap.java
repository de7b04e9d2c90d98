package com.tradedash.analytics.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field → mismatch flag, in the order the fields were requested.
 */
public record MismatchMap(Map<String, Boolean> flags) {

    public MismatchMap {
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    @JsonValue
    public Map<String, Boolean> flags() {
        return flags;
    }

    /** {@code false} for fields that were not reconciled. */
    public boolean isMismatch(String field) {
        return Boolean.TRUE.equals(flags.get(field));
    }

    @JsonIgnore
    public boolean anyMismatch() {
        return flags.containsValue(Boolean.TRUE);
    }

    @JsonIgnore
    public List<String> mismatchedFields() {
        return flags.entrySet().stream()
            .filter(Map.Entry::getValue)
            .map(Map.Entry::getKey)
            .toList();
    }
}
