package com.botanical.ingestion.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable-copy helpers shared by the model records. Provider payloads
 * routinely contain {@code null} list entries, which {@link List#copyOf} rejects.
 */
final class ModelCollections {

    private ModelCollections() {
    }

    static <T> List<T> copyOrEmpty(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    static <T> List<T> copyOrNull(List<T> values) {
        return values == null ? null : copyOrEmpty(values);
    }

    static <V> Map<Provider, V> copyByProvider(Map<Provider, V> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        EnumMap<Provider, V> copy = new EnumMap<>(Provider.class);
        values.forEach((provider, value) -> {
            if (provider != null && value != null) {
                copy.put(provider, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static boolean allNull(Object... values) {
        for (Object value : values) {
            if (value instanceof List<?> list) {
                if (!list.isEmpty()) {
                    return false;
                }
            } else if (Objects.nonNull(value)) {
                return false;
            }
        }
        return true;
    }
}
