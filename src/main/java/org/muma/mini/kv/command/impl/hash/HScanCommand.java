package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.impl.key.AbstractKeyScanCommand;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.store.StoreResult;

public class HScanCommand extends AbstractKeyScanCommand {

    @Override
    protected String name() {
        return "hscan";
    }

    @Override
    protected StoreResult<ScanPage<String>> scan(KeyspaceStore store, String key, long cursor,
                                                 String pattern, int count) {
        return store.hashScan(key, cursor, pattern, count);
    }
}
