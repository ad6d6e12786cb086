package com.hltvsync.application.usecase;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Merges incoming record fields into a stored row.
 *
 * Rules:
 * 1. A non-null incoming value replaces the stored one
 * 2. A field absent from the incoming map leaves the stored value alone
 * 3. An incoming explicit null (intentionally empty) is only written where the row has no such key
 */
final class FieldMerger {

    private FieldMerger() {
    }

    static MergeResult merge(Map<String, Object> existing, Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        boolean changed = false;
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                if (!merged.containsKey(field)) {
                    merged.put(field, null);
                    changed = true;
                }
            } else if (!Objects.equals(merged.get(field), value)) {
                merged.put(field, value);
                changed = true;
            }
        }
        return new MergeResult(merged, changed);
    }

    record MergeResult(Map<String, Object> row, boolean changed) {
    }
}
