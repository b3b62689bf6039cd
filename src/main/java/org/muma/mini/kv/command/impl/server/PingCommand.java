package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.isEmpty()) {
            return SimpleString.PONG;
        }
        if (args.size() > 1) {
            return errorArgs("ping");
        }
        return new BulkString(args.get(0));
    }
}
