package org.muma.mini.kv.command.impl.zset;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.structure.zset.ZSetEntry;

import java.util.List;

/**
 * 命令: ZRANGE key start stop [WITHSCORES]
 * <p>
 * 定位起点 O(logN)，SkipList 通过 span 跳到 rank = start 的节点，之后沿 level 0 向后遍历 M 个。
 * 总体 O(logN + M)。
 * <p>
 * 带 WITHSCORES 时每个元素是一个 [score, member] 二元数组。
 */
public class ZRangeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 3 && args.size() != 4) {
            return errorArgs("zrange");
        }

        String key = args.get(0);
        long start = parseLong(args.get(1));
        long stop = parseLong(args.get(2));

        if (args.size() == 4) {
            if (!"WITHSCORES".equalsIgnoreCase(args.get(3))) {
                return new ErrorMessage("ERR syntax error");
            }
            return reply(store.zRangeWithScores(key, start, stop), entries -> {
                RedisMessage[] result = new RedisMessage[entries.size()];
                int i = 0;
                for (ZSetEntry entry : entries) {
                    result[i++] = RespReplies.scoreMember(entry.score(), entry.member());
                }
                return new RedisArray(result);
            });
        }
        return reply(store.zRange(key, start, stop), RespReplies::bulkArray);
    }
}
