package org.muma.mini.kv.common;

import org.muma.mini.kv.store.structure.zset.ZSetEntry;
import org.muma.mini.kv.store.structure.zset.ZSkipList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis ZSet 封装
 * SkipList 负责有序 (score, member)，Dict 负责 member -> score 的 O(1) 查询。
 * 两者必须同步更新。
 */
public class RedisZSet {

    private final ZSkipList zsl = new ZSkipList();
    private final Map<String, Double> dict = new HashMap<>();

    /**
     * @return 1 新增或分数变化；0 分数未变
     */
    public int add(double score, String member) {
        Double current = dict.get(member);
        if (current == null) {
            zsl.insert(score, member);
            dict.put(member, score);
            return 1;
        }
        if (current == score) {
            return 0;
        }
        // 分数变化：先删后插，保持顺序
        zsl.delete(current, member);
        zsl.insert(score, member);
        dict.put(member, score);
        return 1;
    }

    public int remove(String member) {
        Double score = dict.remove(member);
        if (score == null) {
            return 0;
        }
        zsl.delete(score, member);
        return 1;
    }

    public Double getScore(String member) {
        return dict.get(member);
    }

    public List<ZSetEntry> rangeWithScores(long start, long stop) {
        return zsl.range(start, stop);
    }

    public List<String> range(long start, long stop) {
        List<ZSetEntry> entries = zsl.range(start, stop);
        List<String> members = new ArrayList<>(entries.size());
        for (ZSetEntry entry : entries) {
            members.add(entry.member());
        }
        return members;
    }

    /**
     * 全部成员，按 (score, member) 排序
     */
    public List<ZSetEntry> entries() {
        return zsl.toList();
    }

    public int size() {
        return dict.size();
    }

    /**
     * 整数分数不带小数部分 ("3")，其他按 Double.toString
     */
    public static String formatScore(double score) {
        if (!Double.isInfinite(score) && score == Math.rint(score) && Math.abs(score) < 1e15) {
            return String.valueOf((long) score);
        }
        if (Double.isInfinite(score)) {
            return score > 0 ? "inf" : "-inf";
        }
        return Double.toString(score);
    }
}
