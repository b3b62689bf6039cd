package org.muma.mini.kv.common;

/**
 * Key 的值类型，创建后不可变
 */
public enum RedisDataType {
    STRING,
    HASH,
    LIST,
    SET,
    ZSET
}
