package org.muma.mini.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.IncompleteFrameException;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例。
 * 解码后的命令交给 {@link CommandDispatcher}，解码器产生的 {@link ErrorMessage} 原样回复。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final CommandDispatcher dispatcher;

    // 所有连接共享的计数器
    private final AtomicInteger connectedClients;
    private final int maxClients;

    // 超出 maxClients 被拒绝的连接，关闭前收到的数据一律丢弃
    private boolean rejected;

    public RedisCommandHandler(CommandDispatcher dispatcher, AtomicInteger connectedClients, int maxClients) {
        this.dispatcher = dispatcher;
        this.connectedClients = connectedClients;
        this.maxClients = maxClients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int clients = connectedClients.incrementAndGet();
        if (maxClients > 0 && clients > maxClients) {
            rejected = true;
            log.warn("Rejecting client {}: max clients {} reached", ctx.channel().remoteAddress(), maxClients);
            ctx.writeAndFlush(new ErrorMessage("ERR max number of clients reached"))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), clients);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int clients = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), clients);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (rejected) {
            return;
        }
        if (msg instanceof ErrorMessage error) {
            // 协议错误，连接保持
            ctx.writeAndFlush(error);
        } else if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        List<String> args;
        try {
            args = array.toArgs();
        } catch (IllegalArgumentException e) {
            ctx.writeAndFlush(new ErrorMessage("ERR " + e.getMessage()));
            return;
        }
        // 空行 / *0
        if (args.isEmpty()) {
            return;
        }

        String commandName = args.get(0).toUpperCase(Locale.ROOT);
        if ("QUIT".equals(commandName)) {
            ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        if (log.isDebugEnabled()) {
            log.debug("Execute Command: {} args={}", commandName, args.subList(1, args.size()));
        }
        RedisMessage response = dispatcher.dispatch(commandName, args.subList(1, args.size()));
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IncompleteFrameException incomplete) {
            log.warn("Client {} closed mid-frame, {} bytes discarded",
                    ctx.channel().remoteAddress(), incomplete.getPendingBytes());
        } else if (cause instanceof ReadTimeoutException) {
            log.info("Client {} idle timeout, closing", ctx.channel().remoteAddress());
        } else if (cause instanceof WriteTimeoutException) {
            log.warn("Client {} write timeout, closing", ctx.channel().remoteAddress());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
