package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisHash;
import org.muma.mini.kv.common.RedisList;
import org.muma.mini.kv.common.RedisSet;
import org.muma.mini.kv.common.RedisZSet;
import org.muma.mini.kv.store.CursorPager;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.store.StoreResult;
import org.muma.mini.kv.store.structure.zset.ZSetEntry;
import org.muma.mini.kv.utils.ScanUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 基于 HashMap + 单把读写锁的 Keyspace 实现。
 * <p>
 * 纯读操作持有读锁，任何可能修改数据 (包括惰性删除过期 Key) 的操作持有写锁，
 * 且锁覆盖整个逻辑步骤，例如 "查类型 -> 修改 -> 删空容器" 是原子的。
 * <p>
 * 本类不启动任何定时任务，定期清理由 {@link org.muma.mini.kv.server.ExpirySweeper} 驱动。
 */
public class MemoryKeyspaceStore implements KeyspaceStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryKeyspaceStore.class);

    // 每次持有写锁最多删除的过期 Key 数
    static final int CLEANUP_BATCH_SIZE = 64;

    // 1. 数据存储 (Key -> Data)
    private final Map<String, RedisData<?>> db = new HashMap<>();

    // 2. 过期索引 (Key -> ExpireAt)，清理时只扫描带 TTL 的 Key
    private final Map<String, Long> ttlMap = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final LongSupplier clock;

    public MemoryKeyspaceStore() {
        this(System::currentTimeMillis);
    }

    /**
     * @param clock 毫秒时钟，测试中可替换
     */
    public MemoryKeyspaceStore(LongSupplier clock) {
        this.clock = clock;
    }

    // ========================= String & Key =========================

    @Override
    public void setString(String key, String value, long ttlMillis) {
        writeLocked(() -> {
            RedisData<String> data = RedisData.ofString(value);
            if (ttlMillis > 0) {
                long now = clock.getAsLong();
                // now + ttl 溢出会变成负数，写入即过期
                if (ttlMillis > Long.MAX_VALUE - now) {
                    throw new IllegalArgumentException("invalid expire time in 'set' command");
                }
                data.setExpireAt(now + ttlMillis);
            }
            put(key, data);
            return null;
        });
    }

    @Override
    public Optional<String> getString(String key) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null || data.getType() != RedisDataType.STRING) {
                return Optional.empty();
            }
            return Optional.of(data.getValue(String.class));
        });
    }

    @Override
    public int delete(String... keys) {
        return writeLocked(() -> {
            int removed = 0;
            for (String key : keys) {
                if (db.containsKey(key)) {
                    remove(key);
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public int exists(String... keys) {
        return readLocked(() -> {
            int count = 0;
            for (String key : keys) {
                if (lookupRead(key) != null) {
                    count++;
                }
            }
            return count;
        });
    }

    @Override
    public List<String> keys(String pattern) {
        Pattern regex = ScanUtil.compileOrNull(pattern);
        return readLocked(() -> matchingKeys(regex));
    }

    // ========================= Hash =========================

    @Override
    public StoreResult<Integer> hashSet(String key, String field, String value) {
        return writeLocked(() -> this.<RedisHash>containerForWrite(key, RedisDataType.HASH, RedisHash.class,
                () -> RedisData.ofHash(new RedisHash()))
                .<StoreResult<Integer>>fold(hash -> StoreResult.ok(hash.put(field, value)), e -> StoreResult.wrongType()));
    }

    @Override
    public StoreResult<Optional<String>> hashGet(String key, String field) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Optional.empty());
            }
            if (data.getType() != RedisDataType.HASH) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(Optional.ofNullable(data.getValue(RedisHash.class).get(field)));
        });
    }

    @Override
    public StoreResult<Integer> hashDel(String key, String... fields) {
        return writeLocked(() -> {
            RedisData<?> data = lookupWrite(key);
            if (data == null) {
                return StoreResult.ok(0);
            }
            if (data.getType() != RedisDataType.HASH) {
                return StoreResult.wrongType();
            }
            RedisHash hash = data.getValue(RedisHash.class);
            int removed = 0;
            for (String field : fields) {
                removed += hash.remove(field);
            }
            removeIfEmpty(key, data);
            return StoreResult.ok(removed);
        });
    }

    @Override
    public StoreResult<Map<String, String>> hashGetAll(String key) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Collections.<String, String>emptyMap());
            }
            if (data.getType() != RedisDataType.HASH) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisHash.class).toMap());
        });
    }

    // ========================= List =========================

    @Override
    public StoreResult<Integer> listLPush(String key, String... values) {
        return push(key, true, values);
    }

    @Override
    public StoreResult<Integer> listRPush(String key, String... values) {
        return push(key, false, values);
    }

    private StoreResult<Integer> push(String key, boolean head, String... values) {
        return writeLocked(() -> this.<RedisList>containerForWrite(key, RedisDataType.LIST, RedisList.class,
                () -> RedisData.ofList(new RedisList()))
                .<StoreResult<Integer>>fold(list -> {
                    for (String value : values) {
                        if (head) {
                            list.lpush(value);
                        } else {
                            list.rpush(value);
                        }
                    }
                    return StoreResult.ok(list.size());
                }, e -> StoreResult.wrongType()));
    }

    @Override
    public StoreResult<Optional<String>> listLPop(String key) {
        return pop(key, true);
    }

    @Override
    public StoreResult<Optional<String>> listRPop(String key) {
        return pop(key, false);
    }

    private StoreResult<Optional<String>> pop(String key, boolean head) {
        return writeLocked(() -> {
            RedisData<?> data = lookupWrite(key);
            if (data == null) {
                return StoreResult.ok(Optional.empty());
            }
            if (data.getType() != RedisDataType.LIST) {
                return StoreResult.wrongType();
            }
            RedisList list = data.getValue(RedisList.class);
            String value = head ? list.lpop() : list.rpop();
            removeIfEmpty(key, data);
            return StoreResult.ok(Optional.ofNullable(value));
        });
    }

    @Override
    public StoreResult<List<String>> listRange(String key, long start, long stop) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Collections.<String>emptyList());
            }
            if (data.getType() != RedisDataType.LIST) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisList.class).range(start, stop));
        });
    }

    // ========================= Set =========================

    @Override
    public StoreResult<Integer> setAdd(String key, String... members) {
        return writeLocked(() -> this.<RedisSet>containerForWrite(key, RedisDataType.SET, RedisSet.class,
                () -> RedisData.ofSet(new RedisSet()))
                .<StoreResult<Integer>>fold(set -> {
                    int added = 0;
                    for (String member : members) {
                        added += set.add(member);
                    }
                    return StoreResult.ok(added);
                }, e -> StoreResult.wrongType()));
    }

    @Override
    public StoreResult<Integer> setRemove(String key, String... members) {
        return writeLocked(() -> {
            RedisData<?> data = lookupWrite(key);
            if (data == null) {
                return StoreResult.ok(0);
            }
            if (data.getType() != RedisDataType.SET) {
                return StoreResult.wrongType();
            }
            RedisSet set = data.getValue(RedisSet.class);
            int removed = 0;
            for (String member : members) {
                removed += set.remove(member);
            }
            removeIfEmpty(key, data);
            return StoreResult.ok(removed);
        });
    }

    @Override
    public StoreResult<List<String>> setMembers(String key) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Collections.<String>emptyList());
            }
            if (data.getType() != RedisDataType.SET) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisSet.class).sortedMembers());
        });
    }

    @Override
    public StoreResult<Boolean> setIsMember(String key, String member) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(false);
            }
            if (data.getType() != RedisDataType.SET) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisSet.class).contains(member));
        });
    }

    // ========================= ZSet =========================

    @Override
    public StoreResult<Integer> zAdd(String key, double score, String member) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("value is not a valid float");
        }
        return writeLocked(() -> this.<RedisZSet>containerForWrite(key, RedisDataType.ZSET, RedisZSet.class,
                () -> RedisData.ofZSet(new RedisZSet()))
                .<StoreResult<Integer>>fold(zset -> StoreResult.ok(zset.add(score, member)), e -> StoreResult.wrongType()));
    }

    @Override
    public StoreResult<Optional<Double>> zScore(String key, String member) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Optional.empty());
            }
            if (data.getType() != RedisDataType.ZSET) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(Optional.ofNullable(data.getValue(RedisZSet.class).getScore(member)));
        });
    }

    @Override
    public StoreResult<List<String>> zRange(String key, long start, long stop) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Collections.<String>emptyList());
            }
            if (data.getType() != RedisDataType.ZSET) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisZSet.class).range(start, stop));
        });
    }

    @Override
    public StoreResult<List<ZSetEntry>> zRangeWithScores(String key, long start, long stop) {
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(Collections.<ZSetEntry>emptyList());
            }
            if (data.getType() != RedisDataType.ZSET) {
                return StoreResult.wrongType();
            }
            return StoreResult.ok(data.getValue(RedisZSet.class).rangeWithScores(start, stop));
        });
    }

    @Override
    public StoreResult<Integer> zRem(String key, String... members) {
        return writeLocked(() -> {
            RedisData<?> data = lookupWrite(key);
            if (data == null) {
                return StoreResult.ok(0);
            }
            if (data.getType() != RedisDataType.ZSET) {
                return StoreResult.wrongType();
            }
            RedisZSet zset = data.getValue(RedisZSet.class);
            int removed = 0;
            for (String member : members) {
                removed += zset.remove(member);
            }
            removeIfEmpty(key, data);
            return StoreResult.ok(removed);
        });
    }

    // ========================= SCAN =========================

    @Override
    public ScanPage<String> scan(long cursor, String pattern, int count) {
        Pattern regex = ScanUtil.compileOrNull(pattern);
        List<String> snapshot = readLocked(() -> matchingKeys(regex));
        return CursorPager.page(snapshot, cursor, count);
    }

    @Override
    public StoreResult<ScanPage<String>> hashScan(String key, long cursor, String pattern, int count) {
        Pattern regex = ScanUtil.compileOrNull(pattern);
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(ScanPage.<String>empty());
            }
            if (data.getType() != RedisDataType.HASH) {
                return StoreResult.wrongType();
            }
            RedisHash hash = data.getValue(RedisHash.class);
            List<String> fields = filter(hash.sortedFields(), regex);
            ScanPage<String> page = CursorPager.page(fields, cursor, count);

            List<String> items = new ArrayList<>(page.items().size() * 2);
            for (String field : page.items()) {
                items.add(field);
                items.add(hash.get(field));
            }
            return StoreResult.ok(new ScanPage<>(page.nextCursor(), items));
        });
    }

    @Override
    public StoreResult<ScanPage<String>> setScan(String key, long cursor, String pattern, int count) {
        Pattern regex = ScanUtil.compileOrNull(pattern);
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(ScanPage.<String>empty());
            }
            if (data.getType() != RedisDataType.SET) {
                return StoreResult.wrongType();
            }
            List<String> members = filter(data.getValue(RedisSet.class).sortedMembers(), regex);
            return StoreResult.ok(CursorPager.page(members, cursor, count));
        });
    }

    @Override
    public StoreResult<ScanPage<String>> zsetScan(String key, long cursor, String pattern, int count) {
        Pattern regex = ScanUtil.compileOrNull(pattern);
        return readLocked(() -> {
            RedisData<?> data = lookupRead(key);
            if (data == null) {
                return StoreResult.ok(ScanPage.<String>empty());
            }
            if (data.getType() != RedisDataType.ZSET) {
                return StoreResult.wrongType();
            }
            List<ZSetEntry> entries = new ArrayList<>();
            for (ZSetEntry entry : data.getValue(RedisZSet.class).entries()) {
                if (ScanUtil.matches(regex, entry.member())) {
                    entries.add(entry);
                }
            }
            ScanPage<ZSetEntry> page = CursorPager.page(entries, cursor, count);

            List<String> items = new ArrayList<>(page.items().size() * 2);
            for (ZSetEntry entry : page.items()) {
                items.add(entry.member());
                items.add(RedisZSet.formatScore(entry.score()));
            }
            return StoreResult.ok(new ScanPage<>(page.nextCursor(), items));
        });
    }

    // ========================= 维护 =========================

    /**
     * 先在读锁下收集候选 Key，再分批持有写锁删除，每批重新判定是否过期
     * (期间 Key 可能已被覆盖或删除)。
     */
    @Override
    public int cleanupExpired() {
        List<String> candidates = readLocked(() -> {
            long now = clock.getAsLong();
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, Long> entry : ttlMap.entrySet()) {
                if (now > entry.getValue()) {
                    expired.add(entry.getKey());
                }
            }
            return expired;
        });
        if (candidates.isEmpty()) {
            return 0;
        }

        int removed = 0;
        for (int from = 0; from < candidates.size(); from += CLEANUP_BATCH_SIZE) {
            List<String> batch = candidates.subList(from, Math.min(from + CLEANUP_BATCH_SIZE, candidates.size()));
            removed += writeLocked(() -> {
                long now = clock.getAsLong();
                int n = 0;
                for (String key : batch) {
                    RedisData<?> data = db.get(key);
                    if (data != null && data.isExpired(now)) {
                        remove(key);
                        n++;
                    }
                }
                return n;
            });
        }

        log.debug("Active cleanup: candidates {}, expired {}", candidates.size(), removed);
        return removed;
    }

    @Override
    public int size() {
        return readLocked(db::size);
    }

    @Override
    public void flush() {
        writeLocked(() -> {
            db.clear();
            ttlMap.clear();
            return null;
        });
    }

    // ========================= 内部方法 (调用方已持有锁) =========================

    /**
     * 读路径：过期视为不存在，但不删除 (读锁下不能修改)
     */
    private RedisData<?> lookupRead(String key) {
        RedisData<?> data = db.get(key);
        if (data == null || data.isExpired(clock.getAsLong())) {
            return null;
        }
        return data;
    }

    /**
     * 写路径：过期的 Key 顺带删除
     */
    private RedisData<?> lookupWrite(String key) {
        RedisData<?> data = db.get(key);
        if (data == null) {
            return null;
        }
        if (data.isExpired(clock.getAsLong())) {
            remove(key);
            return null;
        }
        return data;
    }

    /**
     * 取出指定类型的容器，不存在则创建
     */
    private <C> StoreResult<C> containerForWrite(String key, RedisDataType type, Class<C> clazz,
                                                 Supplier<RedisData<C>> factory) {
        RedisData<?> data = lookupWrite(key);
        if (data == null) {
            RedisData<C> created = factory.get();
            put(key, created);
            return StoreResult.ok(created.getData());
        }
        if (data.getType() != type) {
            return StoreResult.wrongType();
        }
        return StoreResult.ok(data.getValue(clazz));
    }

    private void put(String key, RedisData<?> data) {
        db.put(key, data);
        // 有过期时间则记录到 ttlMap，否则移除 (可能由有过期变为无过期)
        if (data.hasExpire()) {
            ttlMap.put(key, data.getExpireAt());
        } else {
            ttlMap.remove(key);
        }
    }

    private void remove(String key) {
        ttlMap.remove(key);
        db.remove(key);
    }

    private void removeIfEmpty(String key, RedisData<?> data) {
        if (data.isEmptyContainer()) {
            remove(key);
        }
    }

    private List<String> matchingKeys(Pattern regex) {
        long now = clock.getAsLong();
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, RedisData<?>> entry : db.entrySet()) {
            if (!entry.getValue().isExpired(now) && ScanUtil.matches(regex, entry.getKey())) {
                result.add(entry.getKey());
            }
        }
        Collections.sort(result);
        return result;
    }

    private static List<String> filter(List<String> sorted, Pattern regex) {
        if (regex == null) {
            return sorted;
        }
        List<String> result = new ArrayList<>();
        for (String item : sorted) {
            if (regex.matcher(item).matches()) {
                result.add(item);
            }
        }
        return result;
    }

    private <T> T readLocked(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T writeLocked(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
