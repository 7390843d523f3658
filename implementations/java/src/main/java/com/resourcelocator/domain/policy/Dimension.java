package com.resourcelocator.domain.policy;

import lombok.NonNull;
import lombok.Value;

/**
 * One axis of a vector policy. Categorical dimensions name the value map
 * that turns an attribute value into a coordinate.
 */
@Value
public class Dimension {

    @NonNull String name;
    @NonNull Type type;
    String map;

    public static Dimension numeric(String name) {
        return new Dimension(name, Type.NUMERIC, null);
    }

    public static Dimension categorical(String name, String map) {
        return new Dimension(name, Type.CATEGORICAL, map);
    }

    public enum Type {
        NUMERIC,
        CATEGORICAL
    }
}
