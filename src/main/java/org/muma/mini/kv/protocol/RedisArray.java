package org.muma.mini.kv.protocol;

import java.util.ArrayList;
import java.util.List;

// 5. 数组 (*) - elements 为 null 表示 Null Array
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 命令帧转为字符串参数列表 (第 0 个元素是命令名)。
     * 非 BulkString 元素视为协议错误。
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            if (!(elements[i] instanceof BulkString bulk)) {
                throw new IllegalArgumentException("Protocol error: expected bulk string at index " + i);
            }
            String s = bulk.asString();
            args.add(s == null ? "" : s);
        }
        return args;
    }
}
