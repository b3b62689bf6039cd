package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.isEmpty()) {
            return errorArgs("del");
        }
        return new RedisInteger(store.delete(args.toArray(new String[0])));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
