package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReplies;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.store.StoreResult;
import org.muma.mini.kv.utils.ScanUtil;

import java.util.List;

/**
 * HSCAN / SSCAN / ZSCAN 的公共骨架
 * 格式: XSCAN key cursor [MATCH pattern] [COUNT count]
 */
public abstract class AbstractKeyScanCommand implements RedisCommand {

    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs(name());
        }

        String key = args.get(0);
        long cursor = parseCursor(args.get(1));
        ScanUtil.ScanParams params = ScanUtil.parse(args, 2);

        return reply(scan(store, key, cursor, params.matchPattern, params.count),
                page -> RespReplies.scanPage(page.nextCursor(), page.items()));
    }

    protected abstract String name();

    protected abstract StoreResult<ScanPage<String>> scan(KeyspaceStore store, String key, long cursor,
                                                          String pattern, int count);
}
