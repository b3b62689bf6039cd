package org.muma.mini.kv.aof;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * AOF 加载器 (Recovery)
 * 启动时逐行重放 AOF 文件。空行和无法解析的行记录 WARN 后跳过。
 * <p>
 * 重放走 {@link CommandDispatcher#execute}，不会再次写入 AOF。
 */
public class AofLoader {

    private static final Logger log = LoggerFactory.getLogger(AofLoader.class);

    private final CommandDispatcher dispatcher;

    public AofLoader(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * @return 成功重放的命令数
     */
    public int load(Path file) {
        if (!Files.exists(file)) {
            log.info("No AOF file found at {}, skipping load.", file.toAbsolutePath());
            return 0;
        }

        long startTime = System.currentTimeMillis();
        int replayed = 0;
        int skipped = 0;
        int lineNo = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }

                AofEntry entry;
                try {
                    entry = AofEntry.fromJson(line);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn("Skipping malformed AOF line {}: {}", lineNo, e.getMessage());
                    skipped++;
                    continue;
                }

                RedisMessage reply = dispatcher.execute(entry.cmd(), entry.args());
                if (reply instanceof ErrorMessage error) {
                    log.warn("AOF line {} ({}) replayed with error: {}", lineNo, entry.cmd(), error.content());
                    skipped++;
                } else {
                    replayed++;
                }
            }
        } catch (IOException e) {
            log.error("Failed to load AOF", e);
            throw new IllegalStateException("AOF load failed: " + file, e);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("AOF file {} loaded. Replayed: {}, skipped: {}, duration: {} ms",
                file.getFileName(), replayed, skipped, duration);
        return replayed;
    }
}
