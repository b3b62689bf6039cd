package org.muma.mini.kv.command.impl.zset;

import org.muma.mini.kv.command.impl.key.AbstractKeyScanCommand;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.store.StoreResult;

/**
 * ZSCAN key cursor [MATCH pattern] [COUNT count]
 * 按有序集合的顺序分页，结果为 member, score 交替
 */
public class ZScanCommand extends AbstractKeyScanCommand {

    @Override
    protected String name() {
        return "zscan";
    }

    @Override
    protected StoreResult<ScanPage<String>> scan(KeyspaceStore store, String key, long cursor,
                                                 String pattern, int count) {
        return store.zsetScan(key, cursor, pattern, count);
    }
}
