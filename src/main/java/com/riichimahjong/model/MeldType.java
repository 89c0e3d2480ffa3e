package com.riichimahjong.model;

/**
 * 副露类型
 */
public enum MeldType {
    CHI(3, true),     // 吃：顺子
    PON(3, true),     // 碰：刻子
    KAN(4, true),     // 明杠
    ANKAN(4, false);  // 暗杠

    private final int size;
    private final boolean open;

    MeldType(int size, boolean open) {
        this.size = size;
        this.open = open;
    }

    public int getSize() {
        return size;
    }

    public boolean isOpen() {
        return open;
    }
}
