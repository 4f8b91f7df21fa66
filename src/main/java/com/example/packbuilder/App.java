package com.example.packbuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar pack-builder.jar <config.json>");
            System.exit(1);
        }
        PackConfig config = new ConfigLoader().load(Path.of(args[0]));
        BuildResult result;
        try (PackBuilder builder = new PackBuilder(config)) {
            result = builder.run();
        }
        // Exit code 2 tells calling scripts that nothing changed.
        System.exit(result.changed() ? 0 : 2);
    }
}
