package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class SRemCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs("srem");
        }
        String[] members = args.subList(1, args.size()).toArray(new String[0]);
        return reply(store.setRemove(args.get(0), members), n -> new RedisInteger(n));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
