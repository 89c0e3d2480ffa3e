package com.riichimahjong.engine;

import com.riichimahjong.model.WinContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 把符/番（或役满倍数）换算成基本点，再按和牌方式拆分给各付款者。
 * <p>
 * 荣和：放铳者支付 基本点 × 6（庄）/ × 4（闲），另加 300 × 本场。
 * 自摸：庄家和牌每家 基本点 × 2；闲家和牌庄家 × 2、闲家 × 1；每家另加 100 × 本场。
 * 每一份都单独向上取整到 100 点。
 */
public class PaymentTranslator {

    private final RuleSet ruleSet;

    public PaymentTranslator(RuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    public PaymentTranslator() {
        this(RuleSet.defaults());
    }

    /**
     * @param fu              符（役满时忽略）
     * @param han             番（役满时忽略）
     * @param yakumanMultiple 役满倍数，非役满为 0
     */
    public Payment translate(int fu, int han, int yakumanMultiple, WinContext context) {
        HandLimit limit;
        int basePoints;
        if (yakumanMultiple > 0) {
            limit = HandLimit.YAKUMAN;
            basePoints = HandLimit.YAKUMAN.getBasePoints() * yakumanMultiple;
        } else {
            limit = limitFor(fu, han);
            basePoints = limit != null ? limit.getBasePoints() : fu * (1 << (2 + han));
        }

        int honba = context.getHonba();
        List<Payment.Share> shares = new ArrayList<>();
        if (context.isRon()) {
            int amount = roundUp100(basePoints * (context.isDealer() ? 6 : 4)) + 300 * honba;
            shares.add(new Payment.Share(Payment.Payer.DISCARDER, amount));
        } else if (context.isDealer()) {
            int each = roundUp100(basePoints * 2) + 100 * honba;
            for (int i = 0; i < 3; i++) {
                shares.add(new Payment.Share(Payment.Payer.NON_DEALER, each));
            }
        } else {
            shares.add(new Payment.Share(Payment.Payer.DEALER, roundUp100(basePoints * 2) + 100 * honba));
            int each = roundUp100(basePoints) + 100 * honba;
            shares.add(new Payment.Share(Payment.Payer.NON_DEALER, each));
            shares.add(new Payment.Share(Payment.Payer.NON_DEALER, each));
        }

        // 荣和由放铳者一人付 300 × 本场，自摸三家各付 100 × 本场，合计相同
        return new Payment(limit, basePoints, shares, 300 * honba, 1000 * context.getRiichiSticks());
    }

    /**
     * 封顶档位；未到满贯返回 null
     */
    HandLimit limitFor(int fu, int han) {
        if (han >= 13) {
            return ruleSet.isKazoeYakuman() ? HandLimit.KAZOE_YAKUMAN : HandLimit.SANBAIMAN;
        }
        if (han >= 11) {
            return HandLimit.SANBAIMAN;
        }
        if (han >= 8) {
            return HandLimit.BAIMAN;
        }
        if (han >= 6) {
            return HandLimit.HANEMAN;
        }
        if (han == 5) {
            return HandLimit.MANGAN;
        }
        int basePoints = fu * (1 << (2 + han));
        if (basePoints >= HandLimit.MANGAN.getBasePoints()) {
            return HandLimit.MANGAN;
        }
        // 切上满贯：30符4番、60符3番（基本点 1920）
        if (ruleSet.isKiriageMangan() && basePoints == 1920) {
            return HandLimit.MANGAN;
        }
        return null;
    }

    static int roundUp100(int points) {
        return (points + 99) / 100 * 100;
    }
}
