package org.muma.mini.kv.command.impl.zset;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.StoreResult;

import java.util.List;

/**
 * ZADD key score member [score member ...]
 * 返回新增或分数发生变化的成员数
 * <p>
 * 所有 score 先全部校验，任何一个非法则整条命令不执行。
 */
public class ZAddCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 3 || (args.size() - 1) % 2 != 0) {
            return errorArgs("zadd");
        }

        String key = args.get(0);
        int pairs = (args.size() - 1) / 2;
        double[] scores = new double[pairs];
        for (int i = 0; i < pairs; i++) {
            scores[i] = parseDouble(args.get(1 + i * 2));
        }

        int changed = 0;
        for (int i = 0; i < pairs; i++) {
            StoreResult<Integer> result = store.zAdd(key, scores[i], args.get(2 + i * 2));
            if (result instanceof StoreResult.Err<Integer> err) {
                return new ErrorMessage(err.error().getMessage());
            }
            changed += result.getOrThrow();
        }
        return new RedisInteger(changed);
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
