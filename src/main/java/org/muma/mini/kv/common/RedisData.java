package org.muma.mini.kv.common;

import lombok.Getter;
import lombok.Setter;

/**
 * Keyspace 中的一个值：类型标签 + 载体 + 过期时间
 * <p>
 * 载体类型与标签一一对应：
 * STRING -> String, HASH -> RedisHash, LIST -> RedisList, SET -> RedisSet, ZSET -> RedisZSet
 */
@Getter
public class RedisData<T> {

    private final RedisDataType type;

    private final T data;

    // 过期时间戳 (ms, -1 表示不过期)
    @Setter
    private long expireAt = -1;

    private RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    public static RedisData<String> ofString(String value) {
        return new RedisData<>(RedisDataType.STRING, value);
    }

    public static RedisData<RedisHash> ofHash(RedisHash hash) {
        return new RedisData<>(RedisDataType.HASH, hash);
    }

    public static RedisData<RedisList> ofList(RedisList list) {
        return new RedisData<>(RedisDataType.LIST, list);
    }

    public static RedisData<RedisSet> ofSet(RedisSet set) {
        return new RedisData<>(RedisDataType.SET, set);
    }

    public static RedisData<RedisZSet> ofZSet(RedisZSet zset) {
        return new RedisData<>(RedisDataType.ZSET, zset);
    }

    /**
     * 惰性过期和定期清理共用同一个判定
     */
    public boolean isExpired(long now) {
        return expireAt != -1 && now > expireAt;
    }

    public boolean hasExpire() {
        return expireAt != -1;
    }

    /**
     * 容器类型为空时 Key 必须被删除；STRING 永远不算空
     */
    public boolean isEmptyContainer() {
        return switch (type) {
            case STRING -> false;
            case HASH -> ((RedisHash) data).size() == 0;
            case LIST -> ((RedisList) data).size() == 0;
            case SET -> ((RedisSet) data).size() == 0;
            case ZSET -> ((RedisZSet) data).size() == 0;
        };
    }

    // 避免外部强制转换时报 Unchecked warning，同时也做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName()
                + " but found " + data.getClass().getSimpleName());
    }
}
