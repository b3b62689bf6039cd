package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.StoreResult;

import java.util.List;

/**
 * HSET key field value [field value ...]
 * 返回新增 field 的数量
 */
public class HSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        // Key + 成对的 field/value
        if (args.size() < 3 || (args.size() - 1) % 2 != 0) {
            return errorArgs("hset");
        }

        String key = args.get(0);
        int created = 0;
        for (int i = 1; i < args.size(); i += 2) {
            StoreResult<Integer> result = store.hashSet(key, args.get(i), args.get(i + 1));
            if (result instanceof StoreResult.Err<Integer> err) {
                // 类型错误只可能出现在第一对上，此时尚未修改任何数据
                return new ErrorMessage(err.error().getMessage());
            }
            created += result.getOrThrow();
        }
        return new RedisInteger(created);
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
