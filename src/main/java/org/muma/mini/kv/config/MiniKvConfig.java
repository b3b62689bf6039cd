package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (mini-kv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);
    private static final MiniKvConfig INSTANCE = new MiniKvConfig();

    public static final String DEFAULT_CONFIG_FILE = "mini-kv.properties";

    // --- Server ---
    private int port = 6379;
    private int maxClients = 1000;
    private long readTimeoutMs = 30_000;   // 0 = 不超时
    private long writeTimeoutMs = 30_000;
    private long cleanupIntervalMs = 1000;

    // --- Protocol ---
    private long maxBulkLength = 512L * 1024 * 1024;
    private int maxArrayLength = 1_000_000;

    // --- Persistence (AOF) ---
    private boolean appendOnly = false;
    private AppendFsync appendFsync = AppendFsync.EVERYSEC;
    private String appendDir = "./data";
    private String appendFilename = "commands.aof";

    private String configFilePath = DEFAULT_CONFIG_FILE;

    public enum AppendFsync {
        ALWAYS, EVERYSEC, NO
    }

    // --- Singleton Access ---
    private MiniKvConfig() {
    }

    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    /**
     * 全新的默认配置，不影响单例 (测试使用)
     */
    public static MiniKvConfig defaults() {
        return new MiniKvConfig();
    }

    // --- Loading Logic ---

    /**
     * 按优先级完整加载：配置文件 -> 环境变量 -> 命令行参数
     */
    public MiniKvConfig load(String[] args) {
        // --config 需要在读文件之前确定
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        applyEnvOverrides(System.getenv());
        parseArgs(args);
        log.info("MiniKvConfig initialized: {}", this);
        return this;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring option without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> i++;
                case "--port" -> this.port = parseInt("--port", args[++i]);
                case "--appendonly" -> this.appendOnly = "yes".equalsIgnoreCase(args[++i]);
                case "--appenddir" -> this.appendDir = args[++i];
                case "--appendfsync" -> this.appendFsync = parseFsync(args[++i]);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Server
        this.port = getInt(props, "server.port", this.port);
        this.maxClients = getInt(props, "server.max_clients", this.maxClients);
        this.readTimeoutMs = getLong(props, "server.read_timeout_ms", this.readTimeoutMs);
        this.writeTimeoutMs = getLong(props, "server.write_timeout_ms", this.writeTimeoutMs);
        this.cleanupIntervalMs = getLong(props, "server.cleanup_interval_ms", this.cleanupIntervalMs);

        // 2. Protocol
        this.maxBulkLength = getLong(props, "proto.max_bulk_length", this.maxBulkLength);
        this.maxArrayLength = getInt(props, "proto.max_array_length", this.maxArrayLength);

        // 3. Persistence
        loadPersistenceConfig(props);
    }

    /**
     * @param env 环境变量表，测试中可传入自定义 Map
     */
    public void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt("MINIKV_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envAof = env.get("MINIKV_APPENDONLY");
        if (envAof != null) {
            this.appendOnly = "yes".equalsIgnoreCase(envAof);
            log.info("Appendonly overridden by ENV: {}", this.appendOnly);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 优先 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 再尝试文件系统路径
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void loadPersistenceConfig(Properties props) {
        String aof = getString(props, "appendonly", appendOnly ? "yes" : "no");
        this.appendOnly = "yes".equalsIgnoreCase(aof);

        String fsync = props.getProperty("appendfsync");
        if (fsync != null) {
            this.appendFsync = parseFsync(fsync);
        }

        this.appendDir = getString(props, "appenddir", this.appendDir);
        this.appendFilename = getString(props, "appendfilename", this.appendFilename);
    }

    private AppendFsync parseFsync(String value) {
        try {
            return AppendFsync.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid appendfsync value '{}', using {}.", value, this.appendFsync);
            return this.appendFsync;
        }
    }

    private int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + val, e);
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", maxClients=" + maxClients + ", aof=" + appendOnly
                + ", fsync=" + appendFsync + ", appendDir=" + appendDir + "}";
    }
}
