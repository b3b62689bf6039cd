package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * KEYS [pattern]，省略 pattern 时等同于 "*"
 */
public class KeysCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() > 1) {
            return errorArgs("keys");
        }
        String pattern = args.isEmpty() ? "*" : args.get(0);
        return RespReplies.bulkArray(store.keys(pattern));
    }
}
