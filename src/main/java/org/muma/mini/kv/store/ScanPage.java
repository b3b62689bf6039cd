package org.muma.mini.kv.store;

import java.util.Collections;
import java.util.List;

/**
 * SCAN 系列的一页结果。nextCursor 为 0 表示遍历结束。
 */
public record ScanPage<T>(long nextCursor, List<T> items) {

    public static <T> ScanPage<T> empty() {
        return new ScanPage<>(0, Collections.emptyList());
    }

    public boolean isComplete() {
        return nextCursor == 0;
    }
}
