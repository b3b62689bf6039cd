package org.muma.mini.kv.command.impl.zset;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisZSet;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class ZScoreCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 2) {
            return errorArgs("zscore");
        }
        return reply(store.zScore(args.get(0), args.get(1)),
                score -> score.<RedisMessage>map(s -> new BulkString(RedisZSet.formatScore(s)))
                        .orElse(BulkString.NULL));
    }
}
