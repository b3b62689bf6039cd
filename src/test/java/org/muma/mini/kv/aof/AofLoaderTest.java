package org.muma.mini.kv.aof;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.impl.MemoryKeyspaceStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AofLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testRecoveryAfterRestart() throws Exception {
        Path file = tempDir.resolve("commands.aof");

        // 1. 第一次启动，写入数据
        KeyspaceStore first = new MemoryKeyspaceStore();
        try (AppendOnlyLog aof = new AppendOnlyLog(file, MiniKvConfig.AppendFsync.ALWAYS)) {
            aof.open();
            CommandDispatcher dispatcher = new CommandDispatcher(first, aof);
            dispatcher.dispatch("set", List.of("k", "v"));
            dispatcher.dispatch("hset", List.of("h", "f", "1"));
            dispatcher.dispatch("rpush", List.of("l", "a", "b"));
            dispatcher.dispatch("lpop", List.of("l"));
            dispatcher.dispatch("sadd", List.of("s", "x"));
            dispatcher.dispatch("zadd", List.of("z", "1.5", "m"));
            dispatcher.dispatch("del", List.of("k"));
            dispatcher.dispatch("get", List.of("h"));
            dispatcher.dispatch("hset", List.of("l", "f", "v"));
        }

        // 2. 模拟重启，重放
        KeyspaceStore second = new MemoryKeyspaceStore();
        int replayed = new AofLoader(new CommandDispatcher(second)).load(file);

        assertEquals(7, replayed);
        assertEquals(0, second.exists("k"));
        assertEquals(Optional.of("1"), second.hashGet("h", "f").getOrThrow());
        assertEquals(List.of("b"), second.listRange("l", 0, -1).getOrThrow());
        assertTrue(second.setIsMember("s", "x").getOrThrow());
        assertEquals(Optional.of(1.5), second.zScore("z", "m").getOrThrow());

        // 重放不会再写 AOF
        assertEquals(7, Files.readAllLines(file).size());
    }

    @Test
    void testBinaryValuesSurviveReplay() throws Exception {
        Path file = tempDir.resolve("binary.aof");
        // 线上字节 FF FE 00 80 以及换行，经 BulkString.CHARSET 映射后的字符串
        String value = new String(new byte[]{(byte) 0xFF, (byte) 0xFE, 0x00, (byte) 0x80, '\n'},
                BulkString.CHARSET);

        try (AppendOnlyLog aof = new AppendOnlyLog(file, MiniKvConfig.AppendFsync.ALWAYS)) {
            aof.open();
            new CommandDispatcher(new MemoryKeyspaceStore(), aof).dispatch("SET", List.of("bin", value));
        }
        assertEquals(1, Files.readAllLines(file).size());

        KeyspaceStore store = new MemoryKeyspaceStore();
        assertEquals(1, new AofLoader(new CommandDispatcher(store)).load(file));
        assertEquals(Optional.of(value), store.getString("bin"));
    }

    @Test
    void testSkipsBlankAndMalformedLines() throws Exception {
        Path file = tempDir.resolve("broken.aof");
        Files.write(file, List.of(
                new AofEntry(1, "SET", List.of("a", "1")).toJson(),
                "",
                "{garbage",
                "{\"ts\":2,\"args\":[\"x\"]}",
                new AofEntry(3, "NOSUCHCMD", List.of()).toJson(),
                new AofEntry(4, "SET", List.of("b", "2")).toJson()
        ));

        KeyspaceStore store = new MemoryKeyspaceStore();
        assertEquals(2, new AofLoader(new CommandDispatcher(store)).load(file));
        assertEquals(Optional.of("1"), store.getString("a"));
        assertEquals(Optional.of("2"), store.getString("b"));
    }

    @Test
    void testMissingFile() {
        KeyspaceStore store = new MemoryKeyspaceStore();
        assertEquals(0, new AofLoader(new CommandDispatcher(store)).load(tempDir.resolve("none.aof")));
        assertEquals(0, store.size());
    }
}
