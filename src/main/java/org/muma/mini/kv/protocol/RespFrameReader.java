package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 请求帧读取器 (无状态，每次调用解析一个完整帧)
 * <p>
 * 支持两种请求格式：
 * 1. Inline: 一行以空白分隔的文本，如 "SET k v\r\n"
 * 2. Multi-bulk: "*N\r\n" 后跟 N 个 "$len\r\n<bytes>\r\n"
 * <p>
 * 约定：
 * - 数据不足时返回 null，readerIndex 回到帧起点，等待更多数据。
 * - 格式错误时抛出 {@link RespProtocolException}。Multi-bulk 出错后，已缓冲的剩余字节会被丢弃到
 *   下一个以 '*' 开头的行为止，坏帧的 payload 不会被当成 inline 命令执行。
 *   尚未到达的字节不做等待，之后的数据照常按新请求解析。
 */
public class RespFrameReader {

    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1_000_000;
    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;

    // 与 Redis 的 PROTO_INLINE_MAX_SIZE 一致
    static final int MAX_INLINE_LENGTH = 64 * 1024;

    private static final byte ASTERISK = '*';
    private static final byte DOLLAR = '$';
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final int maxArrayLength;
    private final long maxBulkLength;

    public RespFrameReader() {
        this(DEFAULT_MAX_ARRAY_LENGTH, DEFAULT_MAX_BULK_LENGTH);
    }

    public RespFrameReader(int maxArrayLength, long maxBulkLength) {
        if (maxArrayLength < 0 || maxBulkLength < 0) {
            throw new IllegalArgumentException("limits must be non-negative");
        }
        this.maxArrayLength = maxArrayLength;
        // byte[] 的上限
        this.maxBulkLength = Math.min(maxBulkLength, Integer.MAX_VALUE - 8);
    }

    /**
     * 读取下一个请求帧。
     *
     * @return 由 BulkString 组成的 RedisArray；数据不足时返回 null
     */
    public RedisArray read(ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }
        if (in.getByte(in.readerIndex()) == ASTERISK) {
            return readMultiBulk(in);
        }
        return readInline(in);
    }

    // --- Inline ---

    private RedisArray readInline(ByteBuf in) {
        int start = in.readerIndex();
        int lf = in.indexOf(start, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                // 没有换行又超长，丢弃已缓冲的数据
                in.skipBytes(in.readableBytes());
                throw new RespProtocolException(RespProtocolException.Reason.INLINE_TOO_LARGE,
                        "too big inline request");
            }
            return null;
        }

        int length = lf - start;
        in.readerIndex(lf + 1);
        if (length > MAX_INLINE_LENGTH) {
            throw new RespProtocolException(RespProtocolException.Reason.INLINE_TOO_LARGE,
                    "too big inline request");
        }

        String line = in.toString(start, length, BulkString.CHARSET).trim();
        if (line.isEmpty()) {
            // 空行：零参数，由上层忽略
            return RedisArray.EMPTY;
        }

        String[] tokens = line.split("\\s+");
        RedisMessage[] elements = new RedisMessage[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            elements[i] = new BulkString(tokens[i]);
        }
        return new RedisArray(elements);
    }

    // --- Multi-bulk ---

    private RedisArray readMultiBulk(ByteBuf in) {
        try {
            return readMultiBulkFrame(in);
        } catch (RespProtocolException e) {
            skipToNextFrame(in);
            throw e;
        }
    }

    private RedisArray readMultiBulkFrame(ByteBuf in) {
        int frameStart = in.readerIndex();

        String header = readLine(in);
        if (header == null) {
            return null;
        }

        long count = parseLength(header.substring(1), "invalid multibulk length");
        if (count < 0) {
            throw malformed("negative multibulk length: " + count);
        }
        if (count > maxArrayLength) {
            throw new RespProtocolException(RespProtocolException.Reason.ARRAY_TOO_LARGE,
                    "array length too large: " + count + " > " + maxArrayLength);
        }

        // 不按声明长度预分配，避免恶意的 *999999 占用内存
        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            String bulkHeader = readLine(in);
            if (bulkHeader == null) {
                in.readerIndex(frameStart);
                return null;
            }
            if (bulkHeader.isEmpty() || bulkHeader.charAt(0) != DOLLAR) {
                throw malformed("expected '$' at index " + i + ", got '" + bulkHeader + "'");
            }

            long length = parseLength(bulkHeader.substring(1), "invalid bulk length at index " + i);
            if (length == -1) {
                // Null Bulk 作为空字符串参数
                elements.add(new BulkString(new byte[0]));
                continue;
            }
            if (length < -1) {
                throw malformed("invalid bulk length at index " + i + ": " + length);
            }
            if (length > maxBulkLength) {
                throw new RespProtocolException(RespProtocolException.Reason.BULK_TOO_LARGE,
                        "bulk string exceeds max length at index " + i + ": " + length + " > " + maxBulkLength);
            }

            if (in.readableBytes() < length + 2) {
                in.readerIndex(frameStart);
                return null;
            }

            byte[] payload = new byte[(int) length];
            in.readBytes(payload);
            byte b1 = in.readByte();
            byte b2 = in.readByte();
            if (b1 != CR || b2 != LF) {
                throw malformed("bulk string at index " + i + " missing CRLF terminator");
            }
            elements.add(new BulkString(payload));
        }

        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    /**
     * 按行丢弃，停在下一个以 '*' 开头的行首；找不到则丢弃全部已缓冲数据
     */
    private void skipToNextFrame(ByteBuf in) {
        int pos = in.readerIndex();
        int end = in.writerIndex();
        while (pos < end) {
            if (in.getByte(pos) == ASTERISK) {
                in.readerIndex(pos);
                return;
            }
            int lf = in.indexOf(pos, end, LF);
            if (lf < 0) {
                break;
            }
            pos = lf + 1;
        }
        in.readerIndex(end);
    }

    /**
     * 读取一行 (不含行尾)。不完整时返回 null 且不移动 readerIndex。
     */
    private String readLine(ByteBuf in) {
        int start = in.readerIndex();
        int lf = in.indexOf(start, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                in.skipBytes(in.readableBytes());
                throw malformed("header line too long");
            }
            return null;
        }
        int end = lf;
        if (end > start && in.getByte(end - 1) == CR) {
            end--;
        }
        String line = in.toString(start, end - start, StandardCharsets.US_ASCII);
        in.readerIndex(lf + 1);
        return line;
    }

    private long parseLength(String s, String message) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw malformed(message + ": '" + s + "'");
        }
    }

    private RespProtocolException malformed(String message) {
        return new RespProtocolException(RespProtocolException.Reason.MALFORMED, message);
    }
}
