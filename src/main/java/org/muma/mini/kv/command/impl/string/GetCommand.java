package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * GET key
 * 不存在、已过期或不是 String 类型都返回 Null Bulk
 */
public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 1) {
            return errorArgs("get");
        }
        return store.getString(args.get(0))
                .<RedisMessage>map(BulkString::new)
                .orElse(BulkString.NULL);
    }
}
