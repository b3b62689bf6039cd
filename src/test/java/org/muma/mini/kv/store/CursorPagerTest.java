package org.muma.mini.kv.store;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CursorPagerTest {

    private final List<String> items = List.of("a", "b", "c", "d", "e");

    @Test
    void testPagesUntilCursorZero() {
        ScanPage<String> first = CursorPager.page(items, 0, 2);
        assertEquals(List.of("a", "b"), first.items());
        assertEquals(2, first.nextCursor());

        ScanPage<String> last = CursorPager.page(items, 4, 2);
        assertEquals(List.of("e"), last.items());
        assertTrue(last.isComplete());
    }

    @Test
    void testExactEndReturnsZeroCursor() {
        ScanPage<String> page = CursorPager.page(items, 3, 2);
        assertEquals(List.of("d", "e"), page.items());
        assertEquals(0, page.nextCursor());
    }

    @Test
    void testCursorBeyondEndAndDefaultCount() {
        assertEquals(ScanPage.empty(), CursorPager.page(items, 99, 2));
        assertEquals(5, CursorPager.page(items, 0, -1).items().size());
        assertTrue(CursorPager.page(List.of(), 0, 10).isComplete());
    }
}
