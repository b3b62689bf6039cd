package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * HDEL key field [field ...]
 * 删空后 Key 会被移除
 */
public class HDelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs("hdel");
        }
        String[] fields = args.subList(1, args.size()).toArray(new String[0]);
        return reply(store.hashDel(args.get(0), fields), n -> new RedisInteger(n));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
