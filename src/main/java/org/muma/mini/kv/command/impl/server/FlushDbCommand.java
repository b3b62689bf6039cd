package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class FlushDbCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (!args.isEmpty()) {
            return errorArgs("flushdb");
        }
        store.flush();
        return SimpleString.OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
