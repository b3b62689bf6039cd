package org.muma.mini.kv.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        MiniKvConfig config = MiniKvConfig.defaults();
        assertEquals(6379, config.getPort());
        assertEquals(1000, config.getMaxClients());
        assertFalse(config.isAppendOnly());
        assertEquals(MiniKvConfig.AppendFsync.EVERYSEC, config.getAppendFsync());
        assertEquals("commands.aof", config.getAppendFilename());
        assertNotSame(MiniKvConfig.getInstance(), config);
    }

    @Test
    void testLoadFromClasspath() {
        MiniKvConfig config = MiniKvConfig.defaults();
        config.loadConfig("test-kv.properties");

        assertEquals(7000, config.getPort());
        assertEquals(5, config.getMaxClients());
        assertEquals(0, config.getReadTimeoutMs());
        assertEquals(30_000, config.getWriteTimeoutMs());
        assertEquals(250, config.getCleanupIntervalMs());
        assertEquals(1024, config.getMaxBulkLength());
        assertTrue(config.isAppendOnly());
        assertEquals("target/test-aof", config.getAppendDir());
        assertEquals(MiniKvConfig.AppendFsync.ALWAYS, config.getAppendFsync());
    }

    @Test
    void testLoadFromFileSystem() throws Exception {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "server.port=7100\nappendfsync=bogus\n");

        MiniKvConfig config = MiniKvConfig.defaults();
        config.loadConfig(file.toString());

        assertEquals(7100, config.getPort());
        // 非法取值保留原值
        assertEquals(MiniKvConfig.AppendFsync.EVERYSEC, config.getAppendFsync());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        MiniKvConfig config = MiniKvConfig.defaults();
        config.loadConfig(tempDir.resolve("nope.properties").toString());
        assertEquals(6379, config.getPort());
    }

    @Test
    void testInvalidNumberFails() throws Exception {
        Path file = tempDir.resolve("bad.properties");
        Files.writeString(file, "server.port=abc\n");

        MiniKvConfig config = MiniKvConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.loadConfig(file.toString()));
    }

    @Test
    void testEnvOverrides() {
        MiniKvConfig config = MiniKvConfig.defaults();
        config.applyEnvOverrides(Map.of("MINIKV_PORT", "6400", "MINIKV_APPENDONLY", "yes"));
        assertEquals(6400, config.getPort());
        assertTrue(config.isAppendOnly());
    }

    @Test
    void testCommandLineArgs() {
        MiniKvConfig config = MiniKvConfig.defaults();
        config.applyEnvOverrides(Map.of("MINIKV_PORT", "6400"));
        config.parseArgs(new String[]{"--port", "6500", "--appendonly", "yes",
                "--appenddir", "/tmp/kv", "--appendfsync", "no", "--unknown", "x"});

        assertEquals(6500, config.getPort());
        assertTrue(config.isAppendOnly());
        assertEquals("/tmp/kv", config.getAppendDir());
        assertEquals(MiniKvConfig.AppendFsync.NO, config.getAppendFsync());
    }

    @Test
    void testLoadUsesConfigArgument() {
        MiniKvConfig config = MiniKvConfig.defaults();
        config.load(new String[]{"--config", "test-kv.properties", "--port", "7200"});
        assertEquals(7200, config.getPort());
        assertEquals(5, config.getMaxClients());
    }
}
