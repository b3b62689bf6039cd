package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

public class SMembersCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() != 1) {
            return errorArgs("smembers");
        }
        return reply(store.setMembers(args.get(0)), RespReplies::bulkArray);
    }
}
