package org.muma.mini.kv.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreResultTest {

    @Test
    void testFold() {
        StoreResult<Integer> ok = StoreResult.ok(3);
        StoreResult<Integer> err = StoreResult.wrongType();

        assertEquals("ok:3", ok.fold(v -> "ok:" + v, e -> "err"));
        assertEquals("err:WRONG_TYPE", err.fold(v -> "ok", e -> "err:" + e.name()));
        assertTrue(ok.isOk());
        assertFalse(err.isOk());
    }

    @Test
    void testGetOrThrow() {
        assertEquals(3, StoreResult.ok(3).getOrThrow());
        WrongTypeException e = assertThrows(WrongTypeException.class,
                () -> StoreResult.<Integer>wrongType().getOrThrow());
        assertEquals(StoreError.WRONG_TYPE.getMessage(), e.getMessage());
    }
}
