package org.muma.mini.kv.store;

import java.util.function.Function;

/**
 * Store 操作的结果：成功值或 {@link StoreError}。
 * 错误作为值返回，调用方用 fold 处理两种情况，或 getOrThrow 转成异常。
 */
public sealed interface StoreResult<T> permits StoreResult.Ok, StoreResult.Err {

    static <T> StoreResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> StoreResult<T> wrongType() {
        return new Err<>(StoreError.WRONG_TYPE);
    }

    <R> R fold(Function<? super T, ? extends R> onOk, Function<StoreError, ? extends R> onErr);

    default boolean isOk() {
        return this instanceof Ok;
    }

    default T getOrThrow() {
        return fold(Function.identity(), error -> {
            throw new WrongTypeException();
        });
    }

    record Ok<T>(T value) implements StoreResult<T> {
        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<StoreError, ? extends R> onErr) {
            return onOk.apply(value);
        }
    }

    record Err<T>(StoreError error) implements StoreResult<T> {
        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<StoreError, ? extends R> onErr) {
            return onErr.apply(error);
        }
    }
}
