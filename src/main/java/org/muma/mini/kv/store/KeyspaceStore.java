package org.muma.mini.kv.store;

import org.muma.mini.kv.store.structure.zset.ZSetEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 类型化的 Keyspace。
 * <p>
 * 约定：
 * 1. 一个 Key 只持有一种类型，类型不匹配的操作返回 {@link StoreError#WRONG_TYPE}，不修改任何数据。
 * 2. 已过期的 Key 对所有读写都视为不存在 (惰性过期)，写路径顺带删除它。
 * 3. 容器 (Hash/List/Set/ZSet) 被删空后立即从 Keyspace 中移除。
 * 4. 不存在的 Key 返回空结果，而不是错误。
 */
public interface KeyspaceStore {

    // --- String & Key ---

    /**
     * @param ttlMillis 大于 0 时设置过期时间，否则不过期
     * @throws IllegalArgumentException 过期时间点超出 long 范围，此时不写入
     */
    void setString(String key, String value, long ttlMillis);

    /**
     * 类型不是 String 时同样返回 empty
     */
    Optional<String> getString(String key);

    /**
     * 删除存在的 Key (不论类型，也不论是否已过期)
     */
    int delete(String... keys);

    int exists(String... keys);

    /**
     * @param pattern glob，null 或 "*" 表示全部
     * @return 未过期且匹配的 Key，按字典序排列
     */
    List<String> keys(String pattern);

    // --- Hash ---

    StoreResult<Integer> hashSet(String key, String field, String value);

    StoreResult<Optional<String>> hashGet(String key, String field);

    StoreResult<Integer> hashDel(String key, String... fields);

    StoreResult<Map<String, String>> hashGetAll(String key);

    // --- List ---

    StoreResult<Integer> listLPush(String key, String... values);

    StoreResult<Integer> listRPush(String key, String... values);

    StoreResult<Optional<String>> listLPop(String key);

    StoreResult<Optional<String>> listRPop(String key);

    StoreResult<List<String>> listRange(String key, long start, long stop);

    // --- Set ---

    StoreResult<Integer> setAdd(String key, String... members);

    StoreResult<Integer> setRemove(String key, String... members);

    StoreResult<List<String>> setMembers(String key);

    StoreResult<Boolean> setIsMember(String key, String member);

    // --- ZSet ---

    /**
     * @return 1 新成员或分数发生变化，0 分数未变
     */
    StoreResult<Integer> zAdd(String key, double score, String member);

    StoreResult<Optional<Double>> zScore(String key, String member);

    StoreResult<List<String>> zRange(String key, long start, long stop);

    StoreResult<List<ZSetEntry>> zRangeWithScores(String key, long start, long stop);

    StoreResult<Integer> zRem(String key, String... members);

    // --- SCAN ---

    ScanPage<String> scan(long cursor, String pattern, int count);

    /**
     * items 为 field, value, field, value ...
     */
    StoreResult<ScanPage<String>> hashScan(String key, long cursor, String pattern, int count);

    StoreResult<ScanPage<String>> setScan(String key, long cursor, String pattern, int count);

    /**
     * items 为 member, score, member, score ...
     */
    StoreResult<ScanPage<String>> zsetScan(String key, long cursor, String pattern, int count);

    // --- 维护 ---

    /**
     * 清理已过期的 Key
     *
     * @return 本次删除的数量
     */
    int cleanupExpired();

    /**
     * 原始条目数，可能包含尚未清理的过期 Key
     */
    int size();

    void flush();
}
