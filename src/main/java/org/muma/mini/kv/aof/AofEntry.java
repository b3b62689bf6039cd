package org.muma.mini.kv.aof;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * AOF 中的一条记录，一行一个 JSON 对象：
 * {"ts":1700000000000000000,"cmd":"SET","args":["k","v"]}
 *
 * @param ts   写入时间 (epoch nanos)
 * @param cmd  命令名 (大写)
 * @param args 参数，不含命令名
 */
public record AofEntry(long ts, String cmd, List<String> args) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static AofEntry of(String cmd, List<String> args) {
        return new AofEntry(System.currentTimeMillis() * 1_000_000L, cmd, List.copyOf(args));
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            // 只包含字符串和数字，理论上不会失败
            throw new IllegalStateException("Failed to serialize AOF entry: " + cmd, e);
        }
    }

    /**
     * @throws JsonProcessingException 行内容不是合法的记录
     */
    public static AofEntry fromJson(String line) throws JsonProcessingException {
        AofEntry entry = MAPPER.readValue(line, AofEntry.class);
        if (entry.cmd() == null || entry.cmd().isEmpty()) {
            throw new IllegalArgumentException("missing cmd");
        }
        return entry.args() == null ? new AofEntry(entry.ts(), entry.cmd(), List.of()) : entry;
    }
}
