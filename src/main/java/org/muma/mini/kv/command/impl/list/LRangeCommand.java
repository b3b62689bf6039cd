package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * LRANGE key start stop
 * 负数索引从尾部计数，越界自动截断
 */
public class LRangeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 3) {
            return errorArgs("lrange");
        }
        long start = parseLong(args.get(1));
        long stop = parseLong(args.get(2));
        return reply(store.listRange(args.get(0), start, stop), RespReplies::bulkArray);
    }
}
