package org.muma.mini.kv.common;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RedisZSetTest {

    private RedisZSet zset;

    @BeforeEach
    void setUp() {
        zset = new RedisZSet();
    }

    @Test
    void testAddReportsNewAndChangedScores() {
        assertEquals(1, zset.add(1.0, "a"));
        // 分数不变
        assertEquals(0, zset.add(1.0, "a"));
        // 分数变化同样计为 1
        assertEquals(1, zset.add(5.0, "a"));

        assertEquals(1, zset.size());
        assertEquals(5.0, zset.getScore("a"));
    }

    @Test
    void testScoreUpdateMovesMember() {
        zset.add(1, "a");
        zset.add(2, "b");
        zset.add(3, "c");

        zset.add(10, "a");

        assertEquals(List.of("b", "c", "a"), zset.range(0, -1));
    }

    @Test
    void testIndexAndOrderStayConsistentAfterRemove() {
        zset.add(1, "a");
        zset.add(2, "b");

        assertEquals(1, zset.remove("a"));
        assertEquals(0, zset.remove("a"));

        assertNull(zset.getScore("a"));
        assertEquals(List.of("b"), zset.range(0, -1));
        assertEquals(1, zset.entries().size());
    }

    @Test
    void testFormatScore() {
        assertEquals("3", RedisZSet.formatScore(3.0));
        assertEquals("-2", RedisZSet.formatScore(-2.0));
        assertEquals("1.5", RedisZSet.formatScore(1.5));
        assertEquals("inf", RedisZSet.formatScore(Double.POSITIVE_INFINITY));
        assertEquals("-inf", RedisZSet.formatScore(Double.NEGATIVE_INFINITY));
    }
}
