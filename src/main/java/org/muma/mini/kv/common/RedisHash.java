package org.muma.mini.kv.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class RedisHash {

    private final Map<String, String> fields = new HashMap<>();

    /**
     * @return 1 表示新字段，0 表示更新
     */
    public int put(String field, String value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public String get(String field) {
        return fields.get(field);
    }

    public int remove(String field) {
        return fields.remove(field) != null ? 1 : 0;
    }

    public int size() {
        return fields.size();
    }

    /**
     * 全量拷贝 (HGETALL)，不暴露内部 Map
     */
    public Map<String, String> toMap() {
        return new HashMap<>(fields);
    }

    public List<String> sortedFields() {
        List<String> names = new ArrayList<>(fields.keySet());
        Collections.sort(names);
        return names;
    }
}
