package org.muma.mini.kv.aof;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AofEntryTest {

    @Test
    void testJsonLineShape() throws Exception {
        AofEntry entry = new AofEntry(42L, "SET", List.of("k", "v 1"));
        String json = entry.toJson();

        assertFalse(json.contains("\n"));
        assertTrue(json.contains("\"cmd\":\"SET\""));
        assertEquals(entry, AofEntry.fromJson(json));
    }

    @Test
    void testUnknownFieldsAndMissingArgs() throws Exception {
        AofEntry entry = AofEntry.fromJson("{\"ts\":1,\"cmd\":\"FLUSHDB\",\"extra\":true}");
        assertEquals("FLUSHDB", entry.cmd());
        assertTrue(entry.args().isEmpty());
    }

    @Test
    void testInvalidLines() {
        assertThrows(JsonProcessingException.class, () -> AofEntry.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> AofEntry.fromJson("{\"ts\":1,\"args\":[]}"));
    }

    @Test
    void testTimestampIsNanos() {
        long before = System.currentTimeMillis();
        AofEntry entry = AofEntry.of("DEL", List.of("k"));
        assertTrue(entry.ts() >= before * 1_000_000L);
    }
}
