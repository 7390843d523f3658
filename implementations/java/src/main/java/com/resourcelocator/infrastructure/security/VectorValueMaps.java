package com.resourcelocator.infrastructure.security;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named lookup tables turning categorical attribute values into coordinates,
 * e.g. {@code fileType: {text/plain: 1, image/jpeg: 2}}.
 *
 * <p>Built once at startup from configuration and shared read-only.
 */
public final class VectorValueMaps {

    private final Map<String, Map<String, Double>> maps;

    public VectorValueMaps(Map<String, Map<String, Double>> maps) {
        Map<String, Map<String, Double>> copy = new HashMap<>();
        if (maps != null) {
            maps.forEach((name, values) -> copy.put(name, Map.copyOf(values)));
        }
        this.maps = Map.copyOf(copy);
    }

    public static VectorValueMaps empty() {
        return new VectorValueMaps(Map.of());
    }

    public Optional<Map<String, Double>> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(maps.get(name));
    }

    public int size() {
        return maps.size();
    }
}
