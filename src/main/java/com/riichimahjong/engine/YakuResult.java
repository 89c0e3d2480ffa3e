package com.riichimahjong.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个拆解的役判定结果：成立的役、宝牌番数、是否役满及役满倍数
 */
public final class YakuResult {

    private final List<YakuEntry> yaku;
    private final List<YakuEntry> dora;
    private final boolean yakuman;
    private final int yakumanMultiple;

    private YakuResult(List<YakuEntry> yaku, List<YakuEntry> dora, boolean yakuman, int yakumanMultiple) {
        this.yaku = Collections.unmodifiableList(new ArrayList<>(yaku));
        this.dora = Collections.unmodifiableList(new ArrayList<>(dora));
        this.yakuman = yakuman;
        this.yakumanMultiple = yakumanMultiple;
    }

    public static YakuResult regular(List<YakuEntry> yaku, List<YakuEntry> dora) {
        return new YakuResult(yaku, dora, false, 0);
    }

    public static YakuResult yakuman(List<YakuEntry> yaku, int multiple) {
        return new YakuResult(yaku, Collections.<YakuEntry>emptyList(), true, multiple);
    }

    /**
     * 成立的役（不含宝牌）
     */
    public List<YakuEntry> getYaku() {
        return yaku;
    }

    /**
     * 宝牌、赤宝牌、里宝牌
     */
    public List<YakuEntry> getDora() {
        return dora;
    }

    public boolean isYakuman() {
        return yakuman;
    }

    public int getYakumanMultiple() {
        return yakumanMultiple;
    }

    /**
     * 至少有一个役才能和牌，宝牌不算役
     */
    public boolean isScoreable() {
        return !yaku.isEmpty();
    }

    public int getYakuHan() {
        int han = 0;
        for (YakuEntry entry : yaku) {
            han += entry.getHan();
        }
        return han;
    }

    public int getDoraHan() {
        int han = 0;
        for (YakuEntry entry : dora) {
            han += entry.getHan();
        }
        return han;
    }

    public int getTotalHan() {
        return getYakuHan() + getDoraHan();
    }

    public boolean contains(Yaku target) {
        for (YakuEntry entry : yaku) {
            if (entry.getYaku() == target) {
                return true;
            }
        }
        return false;
    }

    /**
     * 役在前、宝牌在后的完整列表
     */
    public List<YakuEntry> getAllEntries() {
        List<YakuEntry> all = new ArrayList<>(yaku);
        all.addAll(dora);
        return all;
    }

    @Override
    public String toString() {
        if (yakuman) {
            return "役满×" + yakumanMultiple + " " + yaku;
        }
        return getTotalHan() + "番 " + getAllEntries();
    }
}
