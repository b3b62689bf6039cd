package org.muma.mini.kv.store.structure.zset;

/**
 * 跳表节点。header 节点的 member 为 null。
 */
final class ZSkipListNode {

    final String member;
    final double score;

    final Level[] levels;

    ZSkipListNode(int height, double score, String member) {
        this.score = score;
        this.member = member;
        this.levels = new Level[height];
        for (int i = 0; i < height; i++) {
            this.levels[i] = new Level();
        }
    }

    /**
     * 按 (score, member) 排序时，本节点是否排在给定位置之前
     */
    boolean precedes(double otherScore, String otherMember) {
        return score < otherScore || (score == otherScore && member.compareTo(otherMember) < 0);
    }

    static final class Level {
        ZSkipListNode forward;
        // 到 forward 节点之间跨过的节点数
        int span;
    }

    @Override
    public String toString() {
        return "Node{score=" + score + ", member='" + member + "'}";
    }
}
