package com.example.packbuilder;

import com.example.packbuilder.resource.PackResource;
import com.example.packbuilder.resource.ResourceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Builds the resource set in memory only. There is no earlier state to compare with, so
 * every result is reported as changed.
 */
public final class InMemoryStrategy implements BuildStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStrategy.class);

    @Override
    public BuildResult create(ResourceProvider provider, ParallelPipeline pipeline) throws IOException, InterruptedException {
        BuildResult result = assemble(provider.build(), pipeline).freeze(true);
        LOGGER.info("Built {} resources in memory.", result.size());
        return result;
    }

    @Override
    public boolean exists() {
        return false;
    }

    /**
     * Produces every resource into a fresh builder without touching the disk.
     */
    static BuildResult.Builder assemble(ResourceSet resources, ParallelPipeline pipeline) throws IOException, InterruptedException {
        BuildResult.Builder builder = BuildResult.builder(resources.meta());
        pipeline.forEachParallel(resources.resources(), PackResource::estimatedSize, resource -> {
            builder.put(resource.key(), resource.get());
            LOGGER.debug("This file was successfully zipped: {} ({}/{})", resource.key(), pipeline.progress(), pipeline.goal());
        });
        return builder;
    }
}
