package com.taskagent.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Null-tolerant immutable copies. {@code Map.copyOf} rejects null values,
 * which JSON documents legitimately contain.
 */
final class Collections2 {

    private Collections2() {
    }

    static <V> Map<String, V> copyOf(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }
}
