package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * SADD key member [member ...]
 * 返回实际新增的成员数，重复成员不计
 */
public class SAddCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs("sadd");
        }
        String[] members = args.subList(1, args.size()).toArray(new String[0]);
        return reply(store.setAdd(args.get(0), members), n -> new RedisInteger(n));
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
