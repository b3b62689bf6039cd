package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * DBSIZE
 * 返回原始条目数，可能包含尚未被清理的过期 Key (与 Redis 行为一致)
 */
public class DbSizeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (!args.isEmpty()) {
            return errorArgs("dbsize");
        }
        return new RedisInteger(store.size());
    }
}
