package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.KeyspaceStore;

import java.util.List;

/**
 * SET key value [EX seconds | PX milliseconds]
 * 无论原来是什么类型都直接覆盖为 String，并清除旧的过期时间。
 */
public class SetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyspaceStore store, List<String> args) {
        if (args.size() < 2) {
            return errorArgs("set");
        }

        String key = args.get(0);
        String value = args.get(1);
        long ttlMillis = 0;
        boolean expireGiven = false;

        for (int i = 2; i < args.size(); i += 2) {
            if (i + 1 >= args.size()) {
                return new ErrorMessage("ERR syntax error");
            }
            String option = args.get(i).toUpperCase();
            if (!"EX".equals(option) && !"PX".equals(option)) {
                return new ErrorMessage("ERR syntax error");
            }
            if (expireGiven) {
                // EX 与 PX 只能出现一次
                return new ErrorMessage("ERR syntax error");
            }

            long amount;
            try {
                amount = Long.parseLong(args.get(i + 1));
            } catch (NumberFormatException e) {
                return new ErrorMessage("ERR value is not an integer or out of range");
            }
            if (amount <= 0 || ("EX".equals(option) && amount > Long.MAX_VALUE / 1000)) {
                return new ErrorMessage("ERR invalid expire time in 'set' command");
            }
            ttlMillis = "EX".equals(option) ? amount * 1000 : amount;
            expireGiven = true;
        }

        store.setString(key, value, ttlMillis);
        return SimpleString.OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
