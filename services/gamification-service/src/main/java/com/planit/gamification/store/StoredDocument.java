package com.planit.gamification.store;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A document as read from the store: its fields plus the version the store assigned to the
 * write that produced them. Versions start at 1 and grow by one per write.
 */
@Getter
@AllArgsConstructor
@ToString
public final class StoredDocument {

    private final DocumentPath path;
    private final Map<String, Object> fields;
    private final long version;

    public String getId() {
        return path.id();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public long getLong(String field, long defaultValue) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public Instant getInstant(String field) {
        return Values.toInstant(fields.get(field));
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getMapList(String field) {
        Object value = fields.get(field);
        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(Map.class::isInstance)
                    .map(item -> (Map<String, Object>) item)
                    .toList();
        }
        return Collections.emptyList();
    }
}
