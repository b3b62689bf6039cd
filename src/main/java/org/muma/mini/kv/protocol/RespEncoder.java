package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * RedisMessage -> RESP2 字节流
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final int NIL_LENGTH = -1;

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        write(out, msg);
    }

    /**
     * 递归写入，数组元素可以是任意 RedisMessage (包括嵌套数组)
     */
    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            writeLine(out, '+', s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, '-', e.content());
        } else if (msg instanceof RedisInteger i) {
            writeLength(out, ':', i.value());
        } else if (msg instanceof BulkString b) {
            if (b.isNull()) {
                writeLength(out, '$', NIL_LENGTH);
                return;
            }
            writeLength(out, '$', b.content().length);
            out.writeBytes(b.content());
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisArray a) {
            if (a.elements() == null) {
                writeLength(out, '*', NIL_LENGTH);
                return;
            }
            writeLength(out, '*', a.size());
            for (RedisMessage element : a.elements()) {
                write(out, element);
            }
        }
    }

    private static void writeLine(ByteBuf out, char prefix, String content) {
        out.writeByte(prefix);
        out.writeCharSequence(content, BulkString.CHARSET);
        out.writeBytes(CRLF);
    }

    private static void writeLength(ByteBuf out, char prefix, long n) {
        out.writeByte(prefix);
        out.writeCharSequence(Long.toString(n), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
