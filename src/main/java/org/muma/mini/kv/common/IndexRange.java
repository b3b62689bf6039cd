package org.muma.mini.kv.common;

/**
 * LRANGE / ZRANGE 的索引解析
 * <p>
 * 负数索引先换算成 length + index；start 下限截断到 0，stop 上限截断到 length - 1；
 * start > stop 或 start 越界时为空区间。
 *
 * @param from 闭区间起点 (0-based)
 * @param to   闭区间终点 (0-based)
 */
public record IndexRange(int from, int to) {

    private static final IndexRange EMPTY = new IndexRange(0, -1);

    public static IndexRange resolve(long start, long stop, int length) {
        if (length == 0) {
            return EMPTY;
        }
        if (start < 0) {
            start = length + start;
        }
        if (stop < 0) {
            stop = length + stop;
        }
        if (start < 0) {
            start = 0;
        }
        if (stop >= length) {
            stop = length - 1;
        }
        if (start > stop || start >= length) {
            return EMPTY;
        }
        return new IndexRange((int) start, (int) stop);
    }

    public boolean isEmpty() {
        return to < from;
    }

    public int length() {
        return isEmpty() ? 0 : to - from + 1;
    }
}
