package com.example.packbuilder.resource;

import java.util.Map;

/**
 * Opaque build metadata handed through from the resource provider to the build result.
 */
public record PackMeta(Map<String, Object> properties) {
    public static final PackMeta EMPTY = new PackMeta(Map.of());

    public PackMeta {
        properties = Map.copyOf(properties);
    }
}
