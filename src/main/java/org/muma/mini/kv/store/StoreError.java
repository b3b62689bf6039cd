package org.muma.mini.kv.store;

/**
 * Store 层可预期的错误。
 * message 直接作为 RESP 错误回复的内容。
 */
public enum StoreError {

    WRONG_TYPE("WRONGTYPE Operation against a key holding the wrong kind of value");

    private final String message;

    StoreError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
