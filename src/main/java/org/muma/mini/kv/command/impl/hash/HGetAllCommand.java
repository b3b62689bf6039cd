package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * HGETALL key
 * 返回 field, value 交替排列的数组，按 field 排序以保证输出稳定
 */
public class HGetAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 1) {
            return errorArgs("hgetall");
        }
        return reply(store.hashGetAll(args.get(0)), map -> {
            RedisMessage[] result = new RedisMessage[map.size() * 2];
            int i = 0;
            for (Map.Entry<String, String> entry : new TreeMap<>(map).entrySet()) {
                result[i++] = new BulkString(entry.getKey());
                result[i++] = new BulkString(entry.getValue());
            }
            return new RedisArray(result);
        });
    }
}
