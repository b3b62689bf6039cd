package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespEncoderTest {

    private static String encode(RedisMessage msg) {
        ByteBuf out = Unpooled.buffer();
        RespEncoder.write(out, msg);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testScalars() {
        assertEquals("+OK\r\n", encode(SimpleString.OK));
        assertEquals("-ERR bad\r\n", encode(new ErrorMessage("ERR bad")));
        assertEquals(":-42\r\n", encode(new RedisInteger(-42)));
        assertEquals("$5\r\nhello\r\n", encode(new BulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("*-1\r\n", encode(new RedisArray(null)));
    }

    @Test
    void testBulkLengthIsByteCount() {
        byte[] utf8 = "你好".getBytes(StandardCharsets.UTF_8);
        assertEquals("$6\r\n你好\r\n", encode(new BulkString(utf8)));

        // 经过 String 中转后字节不变
        BulkString roundTrip = new BulkString(new BulkString(utf8).asString());
        assertArrayEquals(utf8, roundTrip.content());
    }

    @Test
    void testNestedScanPage() {
        RedisArray page = RespReplies.scanPage(5, List.of("a", "b"));
        assertEquals("*2\r\n$1\r\n5\r\n*2\r\n$1\r\na\r\n$1\r\nb\r\n", encode(page));
    }

    @Test
    void testScoreMemberPair() {
        assertEquals("*2\r\n$1\r\n3\r\n$1\r\nm\r\n", encode(RespReplies.scoreMember(3.0, "m")));
        assertEquals("*2\r\n$3\r\n1.5\r\n$1\r\nm\r\n", encode(RespReplies.scoreMember(1.5, "m")));
    }
}
