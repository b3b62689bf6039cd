package org.muma.mini.kv.protocol;

/**
 * RESP2 回复/请求的五种基本类型
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 是否为错误回复 (-ERR / -WRONGTYPE)，AOF 只记录非错误的写命令
     */
    default boolean isError() {
        return this instanceof ErrorMessage;
    }
}
