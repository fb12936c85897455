package com.sentimento.live.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical payload pushed to every live subscriber.
 *
 * <p>Instances are deeply immutable: {@code metadata} is copied on construction and every nested map
 * or list is wrapped read-only, so an event cannot change after it enters the dispatcher.
 *
 * <pre>{@code
 * {"timestamp":"2025-10-29T22:00:00.000Z","composites":{"hope":0.75,"sorrow":0.25},"metadata":{"source":"analyzer-1"}}
 * }</pre>
 */
@JsonPropertyOrder({"timestamp", "composites", "metadata"})
public record LiveEvent(
        String timestamp,
        Composites composites,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> metadata) {

    public LiveEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(composites, "composites");
        metadata = metadata == null ? Map.of() : freezeMap(metadata);
    }

    public double hope() {
        return composites.hope();
    }

    public double sorrow() {
        return composites.sorrow();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
