package com.example.packbuilder.resource;

import java.util.List;

/**
 * The full logical resource set of one build.
 */
public record ResourceSet(PackMeta meta, List<PackResource> resources) {
    public ResourceSet {
        resources = List.copyOf(resources);
    }
}
