package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.utils.ScanUtil;

import java.util.List;

/**
 * SCAN cursor [MATCH pattern] [COUNT count]
 */
public class ScanCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.isEmpty()) {
            return errorArgs("scan");
        }

        long cursor = parseCursor(args.get(0));
        ScanUtil.ScanParams params = ScanUtil.parse(args, 1);

        ScanPage<String> page = store.scan(cursor, params.matchPattern, params.count);
        return RespReplies.scanPage(page.nextCursor(), page.items());
    }
}
