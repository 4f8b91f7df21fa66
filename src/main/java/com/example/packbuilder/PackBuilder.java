package com.example.packbuilder;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs one build as configured: produces the resources, materializes them with the configured
 * strategy, writes the build report and publishes a changed archive.
 */
public final class PackBuilder implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PackBuilder.class);

    private final PackConfig config;
    private final Function<NameObfuscator.Pair, ResourceProvider> providerFactory;
    private final ArtifactPublisher publisher;

    /**
     * Builds the configured source directory. Its files keep their names whatever
     * {@link PackConfig#useObfuscation()} says, because their contents refer to each other by name;
     * the obfuscators only reach providers passed to the other constructor.
     */
    public PackBuilder(PackConfig config) {
        this(config,
                obfuscators -> new DirectoryResourceProvider(config.sourceDirectory(), config.description()),
                publisherFor(config));
    }

    /**
     * @param providerFactory creates the provider of one build from that build's name obfuscators
     */
    public PackBuilder(PackConfig config,
                       Function<NameObfuscator.Pair, ResourceProvider> providerFactory,
                       ArtifactPublisher publisher) {
        this.config = Objects.requireNonNull(config, "config");
        this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory");
        this.publisher = publisher == null ? ArtifactPublisher.noop() : publisher;
    }

    public BuildResult run() throws IOException, InterruptedException {
        BuildStrategy strategy = config.packType().strategy(config);
        NameObfuscator.Pair obfuscators = NameObfuscator.order(config.useObfuscation())
                .withModels(NameObfuscator.order(config.useObfuscation()));
        ResourceProvider provider = providerFactory.apply(obfuscators);

        BuildResult result;
        try (ExecutorPipeline pipeline = new ExecutorPipeline(config.threadCount())) {
            result = strategy.create(provider, pipeline);
        }

        if (result.changed()) {
            LOGGER.info("Pack build changed ({} resources, hash {}).", result.size(), result.hash());
        } else {
            LOGGER.info("Pack build unchanged; skipping follow-up work.");
        }

        if (config.reportFile().isPresent()) {
            new BuildReportWriter(new Tika()).write(config.reportFile().get(), config.packType(), result);
        }
        if (result.changed() && strategy instanceof ArchiveWriterStrategy) {
            publisher.publish(((ArchiveWriterStrategy) strategy).archive());
        }
        return result;
    }

    @Override
    public void close() {
        publisher.close();
    }

    private static ArtifactPublisher publisherFor(PackConfig config) {
        if (!config.s3SyncEnabled()) {
            return ArtifactPublisher.noop();
        }
        return new S3ArtifactPublisher(
                config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(""),
                config.s3Region()
        );
    }
}
