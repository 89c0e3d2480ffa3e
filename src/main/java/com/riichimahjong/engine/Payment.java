package com.riichimahjong.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 点数支付明细
 */
public final class Payment {

    /**
     * 付款方
     */
    public enum Payer {
        DISCARDER,   // 放铳者（荣和）
        DEALER,      // 庄家（闲家自摸）
        NON_DEALER   // 闲家（自摸）
    }

    /**
     * 一位付款者应付的点数（已含本场）
     */
    public static final class Share {
        private final Payer payer;
        private final int amount;

        public Share(Payer payer, int amount) {
            this.payer = payer;
            this.amount = amount;
        }

        public Payer getPayer() {
            return payer;
        }

        public int getAmount() {
            return amount;
        }

        @Override
        public String toString() {
            return payer + "=" + amount;
        }
    }

    private final HandLimit limit;
    private final int basePoints;
    private final List<Share> shares;
    private final int honbaBonus;
    private final int riichiDeposit;

    public Payment(HandLimit limit, int basePoints, List<Share> shares, int honbaBonus, int riichiDeposit) {
        this.limit = limit;
        this.basePoints = basePoints;
        this.shares = Collections.unmodifiableList(new ArrayList<>(shares));
        this.honbaBonus = honbaBonus;
        this.riichiDeposit = riichiDeposit;
    }

    /**
     * 封顶档位，未到满贯时为 null
     */
    public HandLimit getLimit() {
        return limit;
    }

    public int getBasePoints() {
        return basePoints;
    }

    public List<Share> getShares() {
        return shares;
    }

    /**
     * 本场加点合计（已包含在各付款者的点数中）
     */
    public int getHonbaBonus() {
        return honbaBonus;
    }

    /**
     * 供托立直棒，由和牌者收取
     */
    public int getRiichiDeposit() {
        return riichiDeposit;
    }

    /**
     * 和牌者收入合计：各家支付 + 供托
     */
    public int getTotal() {
        int total = riichiDeposit;
        for (Share share : shares) {
            total += share.getAmount();
        }
        return total;
    }

    @Override
    public String toString() {
        return "Payment{base=" + basePoints + ", limit=" + limit + ", shares=" + shares + ", total=" + getTotal() + "}";
    }
}
