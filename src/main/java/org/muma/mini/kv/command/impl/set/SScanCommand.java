package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.impl.key.AbstractKeyScanCommand;
import org.muma.mini.kv.store.KeyspaceStore;
import org.muma.mini.kv.store.ScanPage;
import org.muma.mini.kv.store.StoreResult;

public class SScanCommand extends AbstractKeyScanCommand {

    @Override
    protected String name() {
        return "sscan";
    }

    @Override
    protected StoreResult<ScanPage<String>> scan(KeyspaceStore store, String key, long cursor,
                                                 String pattern, int count) {
        return store.setScan(key, cursor, pattern, count);
    }
}
