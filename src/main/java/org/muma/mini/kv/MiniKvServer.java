package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.muma.mini.kv.aof.AofLoader;
import org.muma.mini.kv.aof.AppendOnlyLog;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.protocol.RespFrameReader;
import org.muma.mini.kv.server.ExpirySweeper;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.impl.MemoryKeyspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 启动顺序：
 * 1. 初始化 Store 与 Dispatcher
 * 2. 重放 AOF (必须在接收请求之前完成)
 * 3. 打开 AOF 准备追加
 * 4. 启动定期清理与 Netty
 */
public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final KeyspaceStore store;
    private final AtomicInteger connectedClients = new AtomicInteger();

    private AppendOnlyLog aof;
    private CommandDispatcher dispatcher;
    private ExpirySweeper sweeper;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this(config, new MemoryKeyspaceStore());
    }

    public MiniKvServer(MiniKvConfig config, KeyspaceStore store) {
        this.config = config;
        this.store = store;
    }

    public void start() throws IOException, InterruptedException {
        // 1. AOF 恢复数据 (Replay)，此时 Dispatcher 不带 AOF，重放不会被重复记录
        if (config.isAppendOnly()) {
            this.aof = new AppendOnlyLog(config);
            new AofLoader(new CommandDispatcher(store)).load(aof.getFile());
            aof.open();
        }
        this.dispatcher = new CommandDispatcher(store, aof);

        // 2. 定期清理
        this.sweeper = new ExpirySweeper(store, config.getCleanupIntervalMs());
        sweeper.start();

        // 3. Netty
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (config.getReadTimeoutMs() > 0) {
                            pipeline.addLast(new ReadTimeoutHandler(config.getReadTimeoutMs(), TimeUnit.MILLISECONDS));
                        }
                        if (config.getWriteTimeoutMs() > 0) {
                            pipeline.addLast(new WriteTimeoutHandler(config.getWriteTimeoutMs(), TimeUnit.MILLISECONDS));
                        }
                        pipeline.addLast(new RespDecoder(
                                        new RespFrameReader(config.getMaxArrayLength(), config.getMaxBulkLength())))
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(dispatcher, connectedClients, config.getMaxClients()));
                    }
                });

        log.info("Starting mini-kv server on port {}", config.getPort());
        serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        log.info("mini-kv started successfully, listening on {}", serverChannel.localAddress());
    }

    /**
     * 实际监听端口 (port 配置为 0 时由系统分配)
     */
    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        log.info("Shutting down mini-kv...");
        if (sweeper != null) {
            sweeper.stop();
        }
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
            workerGroup = null;
        }
        if (aof != null) {
            aof.close();
        }
        log.info("mini-kv stopped.");
    }

    public static void main(String[] args) throws Exception {
        MiniKvConfig config = MiniKvConfig.getInstance().load(args);
        MiniKvServer server = new MiniKvServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "kv-shutdown"));
        try {
            server.start();
            server.blockUntilShutdown();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            server.stop();
            throw e;
        }
    }
}
