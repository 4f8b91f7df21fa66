package com.example.packbuilder;

import java.io.IOException;

/**
 * One way of materializing a resource set: synchronize a directory, write an archive, or keep it in memory.
 */
public interface BuildStrategy {

    /**
     * Builds every resource of the provider through the pipeline and returns the frozen result.
     * A failure discards everything produced so far.
     */
    BuildResult create(ResourceProvider provider, ParallelPipeline pipeline) throws IOException, InterruptedException;

    /**
     * Whether this strategy's output is already present on disk.
     */
    boolean exists();
}
