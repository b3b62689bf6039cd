package org.muma.mini.kv.store.structure.zset;

import org.muma.mini.kv.common.IndexRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 带跨度 (span) 的跳表，对应 Redis zskiplist。
 * 按 (score 升序, member 字典序) 排列；插入、删除、按排名定位 (ZRANGE) 都是 O(logN)。
 * <p>
 * 非线程安全，由外层 Keyspace 的锁保护。
 */
public class ZSkipList {

    private static final int MAX_LEVEL = 32;
    private static final double P = 0.25;

    private final ZSkipListNode header = new ZSkipListNode(MAX_LEVEL, 0, null);
    private int length;
    private int level = 1;

    /**
     * 插入新节点，调用方保证 member 不存在
     */
    public void insert(double score, String member) {
        ZSkipListNode[] update = new ZSkipListNode[MAX_LEVEL];
        int[] rank = new int[MAX_LEVEL];

        // 1. 自顶向下找每一层的前驱，同时累计前驱的排名
        ZSkipListNode x = header;
        for (int i = level - 1; i >= 0; i--) {
            rank[i] = (i == level - 1) ? 0 : rank[i + 1];
            while (x.levels[i].forward != null && x.levels[i].forward.precedes(score, member)) {
                rank[i] += x.levels[i].span;
                x = x.levels[i].forward;
            }
            update[i] = x;
        }

        // 2. 新层高于当前最高层时，补齐 header 的 span
        int height = randomLevel();
        if (height > level) {
            for (int i = level; i < height; i++) {
                rank[i] = 0;
                update[i] = header;
                update[i].levels[i].span = length;
            }
            level = height;
        }

        // 3. 链入新节点并修正 span
        x = new ZSkipListNode(height, score, member);
        for (int i = 0; i < height; i++) {
            x.levels[i].forward = update[i].levels[i].forward;
            update[i].levels[i].forward = x;

            x.levels[i].span = update[i].levels[i].span - (rank[0] - rank[i]);
            update[i].levels[i].span = (rank[0] - rank[i]) + 1;
        }
        for (int i = height; i < level; i++) {
            update[i].levels[i].span++;
        }
        length++;
    }

    /**
     * @return 是否找到并删除
     */
    public boolean delete(double score, String member) {
        ZSkipListNode[] update = new ZSkipListNode[MAX_LEVEL];
        ZSkipListNode x = header;
        for (int i = level - 1; i >= 0; i--) {
            while (x.levels[i].forward != null && x.levels[i].forward.precedes(score, member)) {
                x = x.levels[i].forward;
            }
            update[i] = x;
        }

        x = x.levels[0].forward;
        if (x == null || x.score != score || !x.member.equals(member)) {
            return false;
        }

        for (int i = 0; i < level; i++) {
            if (update[i].levels[i].forward == x) {
                update[i].levels[i].span += x.levels[i].span - 1;
                update[i].levels[i].forward = x.levels[i].forward;
            } else {
                update[i].levels[i].span -= 1;
            }
        }
        while (level > 1 && header.levels[level - 1].forward == null) {
            level--;
        }
        length--;
        return true;
    }

    /**
     * 按排名区间取节点 (0-based 闭区间，支持负数索引)
     */
    public List<ZSetEntry> range(long start, long stop) {
        IndexRange range = IndexRange.resolve(start, stop, length);
        if (range.isEmpty()) {
            return Collections.emptyList();
        }

        List<ZSetEntry> result = new ArrayList<>(range.length());
        ZSkipListNode node = nodeByRank(range.from() + 1L);
        for (int i = 0; i < range.length() && node != null; i++) {
            result.add(new ZSetEntry(node.member, node.score));
            node = node.levels[0].forward;
        }
        return result;
    }

    public List<ZSetEntry> toList() {
        return range(0, -1);
    }

    public int length() {
        return length;
    }

    // 1-based
    private ZSkipListNode nodeByRank(long rank) {
        ZSkipListNode x = header;
        long traversed = 0;
        for (int i = level - 1; i >= 0; i--) {
            while (x.levels[i].forward != null && traversed + x.levels[i].span <= rank) {
                traversed += x.levels[i].span;
                x = x.levels[i].forward;
            }
            if (traversed == rank) {
                return x;
            }
        }
        return null;
    }

    private int randomLevel() {
        int lvl = 1;
        while (lvl < MAX_LEVEL && (ThreadLocalRandom.current().nextInt() & 0xFFFF) < (P * 0xFFFF)) {
            lvl++;
        }
        return lvl;
    }
}
