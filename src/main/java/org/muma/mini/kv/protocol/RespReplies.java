package org.muma.mini.kv.protocol;

import org.muma.mini.kv.common.RedisZSet;

import java.util.List;

/**
 * 由基本类型组合出的复合回复
 */
public final class RespReplies {

    private RespReplies() {
    }

    /**
     * 字符串列表 -> BulkString 数组
     */
    public static RedisArray bulkArray(List<String> items) {
        RedisMessage[] elements = new RedisMessage[items.size()];
        for (int i = 0; i < items.size(); i++) {
            elements[i] = new BulkString(items.get(i));
        }
        return new RedisArray(elements);
    }

    /**
     * SCAN 系列的分页结果: [cursor, [elements...]]
     */
    public static RedisArray scanPage(long nextCursor, List<String> items) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(String.valueOf(nextCursor)),
                bulkArray(items)
        });
    }

    /**
     * 带分数的 ZSet 成员: [score, member]
     */
    public static RedisArray scoreMember(double score, String member) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(RedisZSet.formatScore(score)),
                new BulkString(member)
        });
    }
}
