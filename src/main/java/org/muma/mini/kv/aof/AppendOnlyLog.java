package org.muma.mini.kv.aof;

import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AOF 写入器 (Async IO)
 * <p>
 * 1. 命令线程 -> 序列化为一行 JSON -> 放入有界队列 -> 立即返回
 * 2. 后台线程 (aof-writer) -> 从队列取数据 -> FileChannel.write
 * 3. fsync 策略：ALWAYS 每条写完即 force；EVERYSEC 由 aof-fsync 线程每秒 force；NO 交给操作系统
 */
public class AppendOnlyLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AppendOnlyLog.class);

    static final int QUEUE_CAPACITY = 100_000;

    private final Path file;
    private final MiniKvConfig.AppendFsync fsyncPolicy;

    // 队列满时阻塞提交方，起到反压作用
    private final BlockingQueue<byte[]> bufferQueue = new ArrayBlockingQueue<>(QUEUE_CAPACITY);

    private FileChannel fileChannel;
    private ExecutorService writerExecutor;
    private ScheduledExecutorService fsyncExecutor;

    private volatile boolean running;

    public AppendOnlyLog(MiniKvConfig config) {
        this(Paths.get(config.getAppendDir(), config.getAppendFilename()), config.getAppendFsync());
    }

    public AppendOnlyLog(Path file, MiniKvConfig.AppendFsync fsyncPolicy) {
        this.file = file;
        this.fsyncPolicy = fsyncPolicy;
    }

    /**
     * 打开文件 (追加模式) 并启动后台线程
     */
    public synchronized void open() throws IOException {
        if (running) {
            return;
        }
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        this.fileChannel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        this.running = true;

        this.writerExecutor = Executors.newSingleThreadExecutor(ThreadUtils.namedThreadFactory("aof-writer"));
        this.writerExecutor.submit(this::writeLoop);

        if (fsyncPolicy == MiniKvConfig.AppendFsync.EVERYSEC) {
            this.fsyncExecutor = Executors.newSingleThreadScheduledExecutor(ThreadUtils.namedThreadFactory("aof-fsync"));
            this.fsyncExecutor.scheduleAtFixedRate(this::performFsync, 1, 1, TimeUnit.SECONDS);
        }
        log.info("Opened AOF file: {} (fsync={})", file.toAbsolutePath(), fsyncPolicy);
    }

    /**
     * 提交一条写命令
     */
    public void append(String command, List<String> args) {
        if (!running) {
            log.warn("AOF is not open, dropping command: {}", command);
            return;
        }
        String line = AofEntry.of(command, args).toJson() + "\n";
        try {
            bufferQueue.put(line.getBytes(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while appending {} to AOF", command);
        }
    }

    /**
     * 后台写入循环，关闭时先把队列写完再退出
     */
    private void writeLoop() {
        while (running || !bufferQueue.isEmpty()) {
            try {
                byte[] data = bufferQueue.poll(100, TimeUnit.MILLISECONDS);
                if (data == null) {
                    continue;
                }
                synchronized (this) {
                    ByteBuffer buf = ByteBuffer.wrap(data);
                    while (buf.hasRemaining()) {
                        fileChannel.write(buf);
                    }
                    if (fsyncPolicy == MiniKvConfig.AppendFsync.ALWAYS) {
                        fileChannel.force(false);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException e) {
                log.error("AOF background write error", e);
            }
        }
    }

    private synchronized void performFsync() {
        if (fileChannel == null || !fileChannel.isOpen()) {
            return;
        }
        try {
            fileChannel.force(false);
        } catch (IOException e) {
            log.warn("AOF fsync failed", e);
        }
    }

    public Path getFile() {
        return file;
    }

    public boolean isOpen() {
        return running;
    }

    /**
     * 停止接收新命令，等待队列写完，force 后关闭文件
     */
    @Override
    public void close() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        if (fsyncExecutor != null) {
            fsyncExecutor.shutdownNow();
        }
        ThreadUtils.shutdownGracefully(writerExecutor, 5000);

        synchronized (this) {
            try {
                fileChannel.force(true);
                fileChannel.close();
            } catch (IOException e) {
                log.error("Error closing AOF channel", e);
            } finally {
                fileChannel = null;
            }
        }
        log.info("AOF closed: {}", file.toAbsolutePath());
    }
}
