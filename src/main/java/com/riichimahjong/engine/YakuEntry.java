package com.riichimahjong.engine;

/**
 * 一个成立的役及其番数（役满记 13 × 倍数）
 */
public final class YakuEntry {
    private final Yaku yaku;
    private final int han;

    public YakuEntry(Yaku yaku, int han) {
        this.yaku = yaku;
        this.han = han;
    }

    public Yaku getYaku() {
        return yaku;
    }

    public int getHan() {
        return han;
    }

    public String getName() {
        return yaku.getDisplayName();
    }

    @Override
    public String toString() {
        return yaku.getDisplayName() + " " + han + "番";
    }
}
