package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * LPUSH key element [element ...]
 * 逐个插入表头，LPUSH a b c 的结果是 [c, b, a]
 */
public class LPushCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs("lpush");
        }
        String[] values = args.subList(1, args.size()).toArray(new String[0]);
        return reply(store.listLPush(args.get(0), values), n -> new RedisInteger(n));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
