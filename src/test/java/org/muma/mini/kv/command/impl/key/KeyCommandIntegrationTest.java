package org.muma.mini.kv.command.impl.key;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.impl.MemoryKeyspaceStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeyCommandIntegrationTest {

    private KeyspaceStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryKeyspaceStore();
        store.setString("user:1", "a", 0);
        store.setString("user:2", "b", 0);
        store.setString("order:1", "c", 0);
        store.hashSet("user:profile", "f", "v");
    }

    private List<String> args(String... args) {
        return List.of(args);
    }

    private List<String> strings(RedisMessage msg) {
        List<String> result = new ArrayList<>();
        for (RedisMessage m : ((RedisArray) msg).elements()) {
            result.add(((BulkString) m).asString());
        }
        return result;
    }

    @Test
    void testDelAndExists() {
        assertEquals(new RedisInteger(2), new ExistsCommand().execute(store, args("user:1", "user:1", "nope")));
        assertEquals(new RedisInteger(2), new DelCommand().execute(store, args("user:1", "user:profile", "nope")));
        assertEquals(new RedisInteger(0), new ExistsCommand().execute(store, args("user:1")));
        assertInstanceOf(ErrorMessage.class, new DelCommand().execute(store, args()));
    }

    @Test
    void testKeys() {
        assertEquals(List.of("order:1", "user:1", "user:2", "user:profile"),
                strings(new KeysCommand().execute(store, args())));
        assertEquals(List.of("user:1", "user:2"), strings(new KeysCommand().execute(store, args("user:?"))));
        assertEquals(List.of("order:1"), strings(new KeysCommand().execute(store, args("*der*"))));
    }

    @Test
    void testGlobStarSpansSlashes() {
        store.setString("logs/2024/01/error", "x", 0);
        store.setString("logs/error", "x", 0);

        assertEquals(List.of("logs/2024/01/error", "logs/error"),
                strings(new KeysCommand().execute(store, args("logs/*"))));
        assertEquals(List.of("logs/2024/01/error"),
                strings(new KeysCommand().execute(store, args("logs/*/error"))));
    }

    @Test
    void testScanVisitsEveryKeyOnce() {
        for (int i = 0; i < 30; i++) {
            store.setString("bulk:" + i, "v", 0);
        }

        Set<String> seen = new HashSet<>();
        String cursor = "0";
        int rounds = 0;
        do {
            RedisArray page = (RedisArray) new ScanCommand().execute(store, args(cursor, "MATCH", "bulk:*", "COUNT", "7"));
            cursor = ((BulkString) page.elements()[0]).asString();
            for (String key : strings(page.elements()[1])) {
                assertTrue(seen.add(key), "duplicate " + key);
            }
            rounds++;
        } while (!"0".equals(cursor));

        assertEquals(30, seen.size());
        assertEquals(5, rounds);
    }

    @Test
    void testScanErrors() {
        assertThrows(IllegalArgumentException.class, () -> new ScanCommand().execute(store, args("-1")));
        assertThrows(IllegalArgumentException.class, () -> new ScanCommand().execute(store, args("0", "COUNT", "0")));
        assertThrows(IllegalArgumentException.class, () -> new ScanCommand().execute(store, args("0", "MATCH")));
    }

    @Test
    void testScanPastEndIsEmpty() {
        RedisArray page = (RedisArray) new ScanCommand().execute(store, args("100"));
        assertEquals("0", ((BulkString) page.elements()[0]).asString());
        assertEquals(0, ((RedisArray) page.elements()[1]).size());
    }
}
