package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class SIsMemberCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 2) {
            return errorArgs("sismember");
        }
        return reply(store.setIsMember(args.get(0), args.get(1)),
                found -> new RedisInteger(found ? 1 : 0));
    }
}
