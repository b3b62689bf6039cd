package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class HGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 2) {
            return errorArgs("hget");
        }
        return reply(store.hashGet(args.get(0), args.get(1)),
                value -> value.<RedisMessage>map(BulkString::new).orElse(BulkString.NULL));
    }
}
