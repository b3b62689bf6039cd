package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 每个连接一个实例。帧解析委托给 {@link RespFrameReader}，
 * 累积缓冲 (cumulation) 由 ByteToMessageDecoder 负责。
 * <p>
 * 协议错误不会关闭连接：转成 {@link ErrorMessage} 交给下游 Handler 直接回复客户端。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    private final RespFrameReader reader;

    public RespDecoder() {
        this(new RespFrameReader());
    }

    public RespDecoder(RespFrameReader reader) {
        this.reader = reader;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            RedisArray frame = reader.read(in);
            if (frame != null) {
                out.add(frame);
            }
        } catch (RespProtocolException e) {
            log.warn("Protocol error from {}: [{}] {}", ctx.channel().remoteAddress(), e.getReason(), e.getMessage());
            out.add(new ErrorMessage("ERR Protocol error: " + e.getMessage()));
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        // 连接已关闭，剩余的字节永远凑不成完整帧
        if (in.isReadable()) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            throw new IncompleteFrameException(pending);
        }
    }
}
