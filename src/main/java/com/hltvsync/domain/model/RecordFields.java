package com.hltvsync.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the stored field map of an extracted record.
 *
 * Observed values are always written. A null value is only written when the field is listed as
 * intentionally empty; otherwise the field is left out so that stored data is not touched.
 * Enums and dates are stored in their string form.
 */
final class RecordFields {

    private final Set<String> emptyFields;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private RecordFields(Set<String> emptyFields) {
        this.emptyFields = emptyFields;
    }

    static RecordFields with(Set<String> emptyFields) {
        return new RecordFields(emptyFields == null ? Set.of() : emptyFields);
    }

    RecordFields put(String name, Object value) {
        if (value != null) {
            fields.put(name, storedForm(value));
        } else if (emptyFields.contains(name)) {
            fields.put(name, null);
        }
        return this;
    }

    Map<String, Object> build() {
        return Collections.unmodifiableMap(fields);
    }

    private static Object storedForm(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        return value;
    }
}
