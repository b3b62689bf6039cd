package org.muma.mini.kv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * 请求帧格式错误 (帧是完整的，但内容不合法)。
 * 只影响当前请求，连接可以继续使用。
 */
public class RespProtocolException extends DecoderException {

    public enum Reason {
        MALFORMED,
        ARRAY_TOO_LARGE,
        BULK_TOO_LARGE,
        INLINE_TOO_LARGE
    }

    private final Reason reason;

    public RespProtocolException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
