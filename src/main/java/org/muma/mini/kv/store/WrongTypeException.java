package org.muma.mini.kv.store;

public class WrongTypeException extends RuntimeException {

    public WrongTypeException() {
        super(StoreError.WRONG_TYPE.getMessage());
    }
}
