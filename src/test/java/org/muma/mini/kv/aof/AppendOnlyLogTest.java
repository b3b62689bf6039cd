package org.muma.mini.kv.aof;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.mini.kv.config.MiniKvConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppendOnlyLogTest {

    @TempDir
    Path tempDir;

    @Test
    void testCloseFlushesQueuedEntries() throws Exception {
        Path file = tempDir.resolve("nested").resolve("test.aof");
        AppendOnlyLog aof = new AppendOnlyLog(file, MiniKvConfig.AppendFsync.EVERYSEC);
        aof.open();
        assertTrue(aof.isOpen());

        for (int i = 0; i < 500; i++) {
            aof.append("SET", List.of("k" + i, "v" + i));
        }
        aof.close();
        assertFalse(aof.isOpen());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(500, lines.size());
        assertEquals(new AofEntry(0, "SET", List.of("k0", "v0")).args(), AofEntry.fromJson(lines.get(0)).args());
        assertEquals(List.of("k499", "v499"), AofEntry.fromJson(lines.get(499)).args());
    }

    @Test
    void testAlwaysPolicyAppendsToExistingFile() throws Exception {
        Path file = tempDir.resolve("always.aof");
        Files.writeString(file, new AofEntry(1, "DEL", List.of("old")).toJson() + "\n");

        try (AppendOnlyLog aof = new AppendOnlyLog(file, MiniKvConfig.AppendFsync.ALWAYS)) {
            aof.open();
            aof.append("SADD", List.of("s", "m"));
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("DEL", AofEntry.fromJson(lines.get(0)).cmd());
        assertEquals("SADD", AofEntry.fromJson(lines.get(1)).cmd());
    }

    @Test
    void testAppendBeforeOpenIsDropped() throws Exception {
        Path file = tempDir.resolve("closed.aof");
        AppendOnlyLog aof = new AppendOnlyLog(file, MiniKvConfig.AppendFsync.NO);
        aof.append("SET", List.of("k", "v"));
        aof.close();
        assertFalse(Files.exists(file));
    }
}
