package com.riichimahjong.engine;

/**
 * 一个可计分的候选：拆解 + 役判定结果 + 符（役满为 0）
 */
public final class ScoreCandidate {
    private final Decomposition decomposition;
    private final YakuResult yakuResult;
    private final int fu;

    public ScoreCandidate(Decomposition decomposition, YakuResult yakuResult, int fu) {
        this.decomposition = decomposition;
        this.yakuResult = yakuResult;
        this.fu = fu;
    }

    public Decomposition getDecomposition() {
        return decomposition;
    }

    public YakuResult getYakuResult() {
        return yakuResult;
    }

    public int getFu() {
        return fu;
    }

    public boolean isYakuman() {
        return yakuResult.isYakuman();
    }

    /**
     * 役 + 宝牌的总番数（役满为 0）
     */
    public int getHan() {
        return yakuResult.isYakuman() ? 0 : yakuResult.getTotalHan();
    }

    @Override
    public String toString() {
        return decomposition + " => " + yakuResult + (isYakuman() ? "" : " " + fu + "符");
    }
}
