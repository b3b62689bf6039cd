package org.muma.mini.kv.store.structure.zset;

public record ZSetEntry(String member, double score) {
}
