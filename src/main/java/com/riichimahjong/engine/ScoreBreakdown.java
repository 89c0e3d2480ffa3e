package com.riichimahjong.engine;

import java.util.List;

/**
 * 最终计分结果，交给界面展示
 */
public final class ScoreBreakdown {
    private final int han;
    private final int fu;
    private final boolean yakuman;
    private final int yakumanMultiple;
    private final List<YakuEntry> yaku;
    private final Payment payment;
    private final DecompositionShape shape;
    private final WaitShape wait;
    private final String decomposition;

    public ScoreBreakdown(ScoreCandidate candidate, Payment payment) {
        YakuResult result = candidate.getYakuResult();
        this.han = candidate.getHan();
        this.fu = candidate.isYakuman() ? 0 : candidate.getFu();
        this.yakuman = result.isYakuman();
        this.yakumanMultiple = result.getYakumanMultiple();
        this.yaku = result.getAllEntries();
        this.payment = payment;
        this.shape = candidate.getDecomposition().getShape();
        this.wait = candidate.getDecomposition().getWait();
        this.decomposition = candidate.getDecomposition().toString();
    }

    /**
     * 总番数（役 + 宝牌），役满为 0
     */
    public int getHan() {
        return han;
    }

    /**
     * 符，役满为 0
     */
    public int getFu() {
        return fu;
    }

    public boolean isYakuman() {
        return yakuman;
    }

    public int getYakumanMultiple() {
        return yakumanMultiple;
    }

    /**
     * 役与宝牌列表（役在前）
     */
    public List<YakuEntry> getYaku() {
        return yaku;
    }

    public Payment getPayment() {
        return payment;
    }

    public HandLimit getLimit() {
        return payment.getLimit();
    }

    public int getBasePoints() {
        return payment.getBasePoints();
    }

    public int getTotalPoints() {
        return payment.getTotal();
    }

    public DecompositionShape getShape() {
        return shape;
    }

    public WaitShape getWait() {
        return wait;
    }

    public String getDecomposition() {
        return decomposition;
    }

    /**
     * 结果标签，如 "30符1番"、"满贯"、"双倍役满"
     */
    public String getLabel() {
        if (yakuman) {
            return yakumanMultiple > 1 ? yakumanMultiple + "倍役满" : HandLimit.YAKUMAN.getDisplayName();
        }
        HandLimit limit = payment.getLimit();
        return limit != null ? limit.getDisplayName() : fu + "符" + han + "番";
    }

    @Override
    public String toString() {
        return getLabel() + " " + getTotalPoints() + "点 " + yaku + " " + payment.getShares();
    }
}
