package org.muma.mini.kv.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Redis List 封装
 * 底层为 ArrayDeque，两端 push/pop 均为 O(1)。
 */
public class RedisList {

    private final Deque<String> elements = new ArrayDeque<>();

    public void lpush(String element) {
        elements.addFirst(element);
    }

    public void rpush(String element) {
        elements.addLast(element);
    }

    public String lpop() {
        return elements.pollFirst();
    }

    public String rpop() {
        return elements.pollLast();
    }

    public int size() {
        return elements.size();
    }

    /**
     * LRANGE，支持负数索引
     * O(S+N)，S 为 start 偏移量
     */
    public List<String> range(long start, long stop) {
        IndexRange range = IndexRange.resolve(start, stop, elements.size());
        if (range.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>(range.length());
        Iterator<String> it = elements.iterator();
        for (int i = 0; i <= range.to(); i++) {
            String value = it.next();
            if (i >= range.from()) {
                result.add(value);
            }
        }
        return result;
    }
}
