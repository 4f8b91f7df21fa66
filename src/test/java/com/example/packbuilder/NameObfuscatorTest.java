package com.example.packbuilder;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameObfuscatorTest {
    @Test
    void assignsTokensInOrderOfFirstUse() {
        NameObfuscator obfuscator = NameObfuscator.order();
        assertEquals("a", obfuscator.obfuscate("steve_head"));
        assertEquals("b", obfuscator.obfuscate("steve_body"));
        assertEquals("a", obfuscator.obfuscate("steve_head"));
        assertEquals("c", obfuscator.obfuscate("steve_arm"));
    }

    @Test
    void switchesToTwoCharactersAtTheThirtySeventhName() {
        NameObfuscator obfuscator = NameObfuscator.order();
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            tokens.add(obfuscator.obfuscate("name-" + i));
        }
        for (int i = 0; i < 36; i++) {
            assertEquals(1, tokens.get(i).length(), "token " + i);
        }
        assertEquals("k", tokens.get(10));
        assertEquals("m", tokens.get(11));
        assertEquals("l", tokens.get(13));
        assertEquals("9", tokens.get(35));
        assertEquals("ab", tokens.get(36));
        assertEquals("bb", tokens.get(37));
        assertEquals("cb", tokens.get(38));
    }

    @Test
    void tokensNeverCollide() {
        NameObfuscator obfuscator = NameObfuscator.order();
        Set<String> tokens = new HashSet<>();
        int previousLength = 0;
        for (int i = 0; i < 50_000; i++) {
            String token = obfuscator.obfuscate("texture/" + i);
            assertTrue(tokens.add(token), "duplicate token " + token);
            assertTrue(token.length() >= previousLength);
            previousLength = token.length();
        }
        assertEquals(4, obfuscator.obfuscate("texture/" + 49_999).length());
    }

    @Test
    void highestSymbolIsNeverZero() {
        assertEquals("a", NameObfuscator.Order.token(0));
        assertEquals("ab", NameObfuscator.Order.token(36));
        assertEquals("99", NameObfuscator.Order.token(36 * 36 - 1));
        assertEquals("aab", NameObfuscator.Order.token(36 * 36));
    }

    @Test
    void noneReturnsInput() {
        assertEquals("models/player_head", NameObfuscator.NONE.obfuscate("models/player_head"));
        assertEquals("", NameObfuscator.NONE.obfuscate(""));
        assertSame(NameObfuscator.NONE, NameObfuscator.order(false));
        assertTrue(NameObfuscator.order(true) instanceof NameObfuscator.Order);
    }

    @Test
    void pairKeepsNamespacesApart() {
        NameObfuscator textures = NameObfuscator.order();
        NameObfuscator.Pair pair = textures.withModels(NameObfuscator.order());
        assertSame(textures, pair.textures());
        assertNotSame(pair.models(), pair.textures());
        assertEquals("a", pair.models().obfuscate("head"));
        assertEquals("b", pair.models().obfuscate("body"));
        assertEquals("a", pair.textures().obfuscate("body"));
    }

    @Test
    void concurrentCallersGetDistinctTokens() throws Exception {
        NameObfuscator.Order obfuscator = (NameObfuscator.Order) NameObfuscator.order();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentHashMap<String, String> assigned = new ConcurrentHashMap<>();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    // every worker asks for the same names to force contention
                    for (int i = 0; i < 1000; i++) {
                        String name = "bone-" + i;
                        String token = obfuscator.obfuscate(name);
                        String previous = assigned.putIfAbsent(name, token);
                        if (previous != null && !previous.equals(token)) {
                            throw new AssertionError("token changed for " + name);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1000, obfuscator.size());
        assertEquals(1000, new HashSet<>(assigned.values()).size());
    }
}
