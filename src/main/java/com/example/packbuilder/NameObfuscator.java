package com.example.packbuilder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps raw names to short tokens derived from the order in which names are first seen.
 */
@FunctionalInterface
public interface NameObfuscator {

    /**
     * Returns names unchanged.
     */
    NameObfuscator NONE = rawName -> rawName;

    /**
     * Returns the token for this name, assigning a new one on first use.
     */
    String obfuscate(String rawName);

    /**
     * Creates a fresh order obfuscator.
     */
    static NameObfuscator order() {
        return new Order();
    }

    /**
     * Creates a fresh order obfuscator, or {@link #NONE} when obfuscation is disabled.
     */
    static NameObfuscator order(boolean enabled) {
        return enabled ? new Order() : NONE;
    }

    /**
     * Pairs this obfuscator, used for textures, with the given models obfuscator.
     */
    default Pair withModels(NameObfuscator models) {
        return pair(models, this);
    }

    static Pair pair(NameObfuscator models, NameObfuscator textures) {
        return new Pair(models, textures);
    }

    final class Order implements NameObfuscator {
        private static final char[] AVAILABLE_NAME = new char[] {
                'a', 'b', 'c', 'd', 'e', 'f', 'g',
                'h', 'i', 'j', 'k', 'm', 'n', 'l', 'o', 'p',
                'q', 'r', 's', 't', 'u', 'v',
                'w', 'x', 'y', 'z',
                '0', '1', '2', '3', '4', '5', '6', '7', '8', '9'
        };

        private final Map<String, String> nameMap = new LinkedHashMap<>();

        private Order() {
        }

        @Override
        public synchronized String obfuscate(String rawName) {
            Objects.requireNonNull(rawName, "rawName");
            String existing = nameMap.get(rawName);
            if (existing != null) {
                return existing;
            }
            String token = token(nameMap.size());
            nameMap.put(rawName, token);
            return token;
        }

        /**
         * Number of names assigned so far.
         */
        public synchronized int size() {
            return nameMap.size();
        }

        /**
         * Encodes an assignment index, least significant symbol first.
         */
        static String token(int index) {
            int size = index;
            StringBuilder builder = new StringBuilder();
            while (size >= AVAILABLE_NAME.length) {
                builder.append(AVAILABLE_NAME[size % AVAILABLE_NAME.length]);
                size /= AVAILABLE_NAME.length;
            }
            builder.append(AVAILABLE_NAME[size]);
            return builder.toString();
        }
    }

    /**
     * Two independent obfuscators so model and texture names never share a token space.
     */
    record Pair(NameObfuscator models, NameObfuscator textures) {
        public Pair {
            Objects.requireNonNull(models, "models");
            Objects.requireNonNull(textures, "textures");
        }
    }
}
