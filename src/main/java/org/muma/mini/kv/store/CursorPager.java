package org.muma.mini.kv.store;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于有序快照的游标分页。
 * 游标就是快照中的偏移量，取 [cursor, cursor + count)。
 */
public final class CursorPager {

    public static final int DEFAULT_COUNT = 10;

    private CursorPager() {
    }

    public static <T> ScanPage<T> page(List<T> snapshot, long cursor, int count) {
        int pageSize = count <= 0 ? DEFAULT_COUNT : count;
        long start = Math.max(cursor, 0);
        if (start >= snapshot.size()) {
            return ScanPage.empty();
        }

        long end = Math.min(start + pageSize, snapshot.size());
        List<T> items = new ArrayList<>(snapshot.subList((int) start, (int) end));
        long next = end >= snapshot.size() ? 0 : end;
        return new ScanPage<>(next, items);
    }
}
