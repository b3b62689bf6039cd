package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * EXISTS key [key ...]
 * 重复的 Key 会被重复计数
 */
public class ExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.isEmpty()) {
            return errorArgs("exists");
        }
        return new RedisInteger(store.exists(args.toArray(new String[0])));
    }
}
