package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class LPopCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 1) {
            return errorArgs("lpop");
        }
        return reply(store.listLPop(args.get(0)),
                value -> value.<RedisMessage>map(BulkString::new).orElse(BulkString.NULL));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
