package com.intervue.evaluation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One deterministic assertion about a submitted answer. {@code details} carries check-specific
 * extras such as {@code rows} or {@code error}, flattened next to name/passed when serialized.
 */
public record RunnerCheck(
        String name,
        boolean passed,
        Map<String, Object> details
) {
    public RunnerCheck {
        Objects.requireNonNull(name, "name is required");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static RunnerCheck of(String name, boolean passed) {
        return new RunnerCheck(name, passed, Map.of());
    }

    public static RunnerCheck of(String name, boolean passed, String detailKey, Object detailValue) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(detailKey, detailValue);
        return new RunnerCheck(name, passed, details);
    }
}
