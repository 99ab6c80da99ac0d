package com.relaybox.infrastructure.id;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UUIDv7GeneratorTest {

    private final UUIDv7Generator generator = new UUIDv7Generator();

    @Test
    void shouldGenerateUniqueIds() {
        Set<UUID> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.generate());
        }
        assertEquals(1000, ids.size(), "All generated UUIDs should be unique");
    }

    @Test
    void shouldGenerateVersion7() {
        assertEquals(7, generator.generate().version());
    }

    @Test
    void shouldPrefixOwnerTokens() {
        String first = generator.ownerToken("run");
        String second = generator.ownerToken("run");

        assertTrue(first.startsWith("run_"));
        assertNotEquals(first, second, "Owner tokens must differ per call");
    }
}
