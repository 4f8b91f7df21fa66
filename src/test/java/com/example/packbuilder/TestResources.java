package com.example.packbuilder;

import com.example.packbuilder.resource.PackMeta;
import com.example.packbuilder.resource.PackResource;
import com.example.packbuilder.resource.ResourceKey;
import com.example.packbuilder.resource.ResourceSet;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds resource providers for tests from plain strings.
 */
final class TestResources {
    private TestResources() {
    }

    static ResourceProvider provider(Map<ResourceKey, String> contents) {
        List<PackResource> resources = new ArrayList<>();
        contents.forEach((key, value) -> resources.add(PackResource.of(key, value.getBytes(StandardCharsets.UTF_8))));
        return () -> new ResourceSet(PackMeta.EMPTY, resources);
    }

    static ResourceProvider provider(String... pathsAndContents) {
        Map<ResourceKey, String> contents = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            contents.put(ResourceKey.root(pathsAndContents[i]), pathsAndContents[i + 1]);
        }
        return provider(contents);
    }

    static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
