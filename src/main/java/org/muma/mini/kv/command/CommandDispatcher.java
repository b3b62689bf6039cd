package org.muma.mini.kv.command;

import org.muma.mini.kv.aof.AppendOnlyLog;
import org.muma.mini.kv.command.impl.hash.HDelCommand;
import org.muma.mini.kv.command.impl.hash.HGetAllCommand;
import org.muma.mini.kv.command.impl.hash.HGetCommand;
import org.muma.mini.kv.command.impl.hash.HScanCommand;
import org.muma.mini.kv.command.impl.hash.HSetCommand;
import org.muma.mini.kv.command.impl.key.DelCommand;
import org.muma.mini.kv.command.impl.key.ExistsCommand;
import org.muma.mini.kv.command.impl.key.KeysCommand;
import org.muma.mini.kv.command.impl.key.ScanCommand;
import org.muma.mini.kv.command.impl.list.LPopCommand;
import org.muma.mini.kv.command.impl.list.LPushCommand;
import org.muma.mini.kv.command.impl.list.LRangeCommand;
import org.muma.mini.kv.command.impl.list.RPopCommand;
import org.muma.mini.kv.command.impl.list.RPushCommand;
import org.muma.mini.kv.command.impl.server.DbSizeCommand;
import org.muma.mini.kv.command.impl.server.EchoCommand;
import org.muma.mini.kv.command.impl.server.FlushDbCommand;
import org.muma.mini.kv.command.impl.server.PingCommand;
import org.muma.mini.kv.command.impl.set.SAddCommand;
import org.muma.mini.kv.command.impl.set.SIsMemberCommand;
import org.muma.mini.kv.command.impl.set.SMembersCommand;
import org.muma.mini.kv.command.impl.set.SRemCommand;
import org.muma.mini.kv.command.impl.set.SScanCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.command.impl.zset.ZAddCommand;
import org.muma.mini.kv.command.impl.zset.ZRangeCommand;
import org.muma.mini.kv.command.impl.zset.ZRemCommand;
import org.muma.mini.kv.command.impl.zset.ZScanCommand;
import org.muma.mini.kv.command.impl.zset.ZScoreCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.WrongTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表 + 分发
 * <p>
 * 两个入口：
 * - {@link #dispatch}: 客户端请求，写命令执行成功后追加到 AOF
 * - {@link #execute}: AOF 重放，只执行不记录
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final long SLOW_COMMAND_MS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final KeyspaceStore store;

    // 未开启 AOF 时为 null
    private final AppendOnlyLog aof;

    public CommandDispatcher(KeyspaceStore store) {
        this(store, null);
    }

    public CommandDispatcher(KeyspaceStore store, AppendOnlyLog aof) {
        this.store = store;
        this.aof = aof;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerKeyCommands();
        registerStringCommands();
        registerHashCommands();
        registerListCommands();
        registerSetCommands();
        registerZSetCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("DBSIZE", new DbSizeCommand());
        commandMap.put("FLUSHDB", new FlushDbCommand());
    }

    private void registerKeyCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
        commandMap.put("KEYS", new KeysCommand());
        commandMap.put("SCAN", new ScanCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HDEL", new HDelCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
        commandMap.put("HSCAN", new HScanCommand());
    }

    private void registerListCommands() {
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("RPUSH", new RPushCommand());
        commandMap.put("LPOP", new LPopCommand());
        commandMap.put("RPOP", new RPopCommand());
        commandMap.put("LRANGE", new LRangeCommand());
    }

    private void registerSetCommands() {
        commandMap.put("SADD", new SAddCommand());
        commandMap.put("SREM", new SRemCommand());
        commandMap.put("SMEMBERS", new SMembersCommand());
        commandMap.put("SISMEMBER", new SIsMemberCommand());
        commandMap.put("SSCAN", new SScanCommand());
    }

    private void registerZSetCommands() {
        commandMap.put("ZADD", new ZAddCommand());
        commandMap.put("ZSCORE", new ZScoreCommand());
        commandMap.put("ZRANGE", new ZRangeCommand());
        commandMap.put("ZREM", new ZRemCommand());
        commandMap.put("ZSCAN", new ZScanCommand());
    }

    /**
     * 客户端入口：执行，并把成功的写命令追加到 AOF
     */
    public RedisMessage dispatch(String commandName, List<String> args) {
        RedisMessage response = execute(commandName, args);

        if (aof != null && !response.isError() && isWrite(commandName)) {
            aof.append(commandName.toUpperCase(Locale.ROOT), args);
        }
        return response;
    }

    /**
     * 核心分发逻辑 (重放入口，不写 AOF)
     *
     * @param args 不含命令名
     */
    public RedisMessage execute(String commandName, List<String> args) {
        // 1. 查找命令
        RedisCommand command = commandMap.get(commandName.toUpperCase(Locale.ROOT));
        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(store, args);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MS) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }
            return response;

        } catch (WrongTypeException e) {
            return new ErrorMessage(e.getMessage());

        } catch (IllegalArgumentException e) {
            // 预期内的客户端错误 (参数个数、数字格式、游标等)
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    public boolean isWrite(String commandName) {
        RedisCommand command = commandMap.get(commandName.toUpperCase(Locale.ROOT));
        return command != null && command.isWrite();
    }

    public boolean hasCommand(String commandName) {
        return commandMap.containsKey(commandName.toUpperCase(Locale.ROOT));
    }
}
