package org.muma.mini.kv.protocol;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

// 4. 批量字符串 ($) - 支持 null (表示 $-1)
public record BulkString(byte[] content) implements RedisMessage {

    /**
     * 线上字节与 Java String 之间的映射。
     * ISO-8859-1 把每个字节对应到 0-255 的一个 char，任意字节序列 (非法 UTF-8、\0) 都能无损往返，
     * 字符串比较的结果也与按无符号字节比较一致。
     */
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(CHARSET));
    }

    public boolean isNull() {
        return content == null;
    }

    public String asString() {
        return content == null ? null : new String(content, CHARSET);
    }
}
