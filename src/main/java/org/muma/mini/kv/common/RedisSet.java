package org.muma.mini.kv.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class RedisSet {

    private final Set<String> members = new HashSet<>();

    /**
     * @return 1 表示新成员，0 表示已存在
     */
    public int add(String member) {
        return members.add(member) ? 1 : 0;
    }

    public int remove(String member) {
        return members.remove(member) ? 1 : 0;
    }

    public boolean contains(String member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    /**
     * 排序后的快照 (SMEMBERS / SSCAN)
     */
    public List<String> sortedMembers() {
        List<String> snapshot = new ArrayList<>(members);
        Collections.sort(snapshot);
        return snapshot;
    }
}
