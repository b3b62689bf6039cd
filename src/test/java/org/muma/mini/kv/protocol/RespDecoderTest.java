package org.muma.mini.kv.protocol;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static void write(EmbeddedChannel channel, String s) {
        channel.writeInbound(Unpooled.copiedBuffer(s, StandardCharsets.UTF_8));
    }

    @Test
    void testPipelinedFrames() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        RedisArray first = channel.readInbound();
        RedisArray second = channel.readInbound();
        assertEquals(List.of("PING"), first.toArgs());
        assertEquals(List.of("GET", "k"), second.toArgs());
        assertNull(channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testFrameSplitAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*2\r\n$4\r\nEC");
        assertNull(channel.readInbound());

        write(channel, "HO\r\n$2\r\nhi\r\n");
        RedisArray frame = channel.readInbound();
        assertEquals(List.of("ECHO", "hi"), frame.toArgs());
    }

    @Test
    void testProtocolErrorKeepsConnectionUsable() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*1\r\n:5\r\n");

        Object error = channel.readInbound();
        assertTrue(error instanceof ErrorMessage);
        assertTrue(((ErrorMessage) error).content().startsWith("ERR Protocol error"));

        write(channel, "PING\r\n");
        RedisArray frame = channel.readInbound();
        assertEquals(List.of("PING"), frame.toArgs());
        assertTrue(channel.isActive());
    }

    @Test
    void testCloseWithPartialFrameRaisesIncompleteFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*2\r\n$3\r\nGET\r\n");

        IncompleteFrameException e = assertThrows(IncompleteFrameException.class, channel::finish);
        assertEquals("*2\r\n$3\r\nGET\r\n".length(), e.getPendingBytes());
    }
}
