package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.StoreResult;

import java.util.List;
import java.util.function.Function;

public interface RedisCommand {

    /**
     * 执行命令
     *
     * @param store Keyspace
     * @param args  参数列表，不含命令名
     */
    RedisMessage execute(KeyspaceStore store, List<String> args);

    /**
     * 辅助工具：快速构建参数个数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * Store 结果转回复：成功走 onOk，失败使用错误自带的 message
     */
    default <T> RedisMessage reply(StoreResult<T> result, Function<? super T, ? extends RedisMessage> onOk) {
        return result.fold(onOk, error -> new ErrorMessage(error.getMessage()));
    }

    /**
     * 解析整数参数，非法时抛出 IllegalArgumentException (由 Dispatcher 转为 ERR 回复)
     */
    default long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value is not an integer or out of range");
        }
    }

    /**
     * 解析分数，支持 inf / +inf / -inf，拒绝 NaN
     */
    default double parseDouble(String value) {
        String lower = value.toLowerCase();
        if ("inf".equals(lower) || "+inf".equals(lower)) {
            return Double.POSITIVE_INFINITY;
        }
        if ("-inf".equals(lower)) {
            return Double.NEGATIVE_INFINITY;
        }
        double d;
        try {
            d = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value is not a valid float");
        }
        if (Double.isNaN(d)) {
            throw new IllegalArgumentException("value is not a valid float");
        }
        return d;
    }

    default long parseCursor(String value) {
        long cursor;
        try {
            cursor = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid cursor");
        }
        if (cursor < 0) {
            throw new IllegalArgumentException("invalid cursor");
        }
        return cursor;
    }

    // 默认不是写命令，SET/HSET 等需要覆盖返回 true (决定是否写入 AOF)
    default boolean isWrite() {
        return false;
    }
}
