package org.muma.mini.kv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * 连接在一个帧的中途关闭 (截断读)。
 * 与 {@link RespProtocolException} 区分：这里不是格式错误，而是输入不完整。
 */
public class IncompleteFrameException extends DecoderException {

    private final int pendingBytes;

    public IncompleteFrameException(int pendingBytes) {
        super("connection closed with " + pendingBytes + " bytes of an incomplete frame buffered");
        this.pendingBytes = pendingBytes;
    }

    public int getPendingBytes() {
        return pendingBytes;
    }
}
