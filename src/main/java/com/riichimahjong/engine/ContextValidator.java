package com.riichimahjong.engine;

import com.riichimahjong.model.Hand;
import com.riichimahjong.model.WinContext;

/**
 * 场况一致性检查：互相矛盾的标记直接拒绝，不做猜测
 */
public class ContextValidator {

    public void validate(Hand hand, WinContext context) {
        if (context.getSeatWind() == null || context.getRoundWind() == null
                || context.getRiichi() == null || context.getWinMethod() == null) {
            reject("风位、立直状态和和牌方式不能为空");
        }
        boolean ron = context.isRon();
        boolean hasCalls = !hand.getMelds().isEmpty();

        // 立直
        if (context.isIppatsu() && !context.getRiichi().isDeclared()) {
            reject("一发需要立直");
        }
        if (context.getRiichi().isDeclared() && !hand.isConcealed()) {
            reject("有明副露不能立直");
        }

        // 自摸 / 荣和
        if (context.isHaitei() && ron) {
            reject("海底摸月只能自摸");
        }
        if (context.isHoutei() && !ron) {
            reject("河底捞鱼只能荣和");
        }
        if (context.isHaitei() && context.isHoutei()) {
            reject("海底与河底不能同时成立");
        }
        if (context.isRinshan() && ron) {
            reject("岭上开花只能自摸");
        }
        if (context.isChankan() && !ron) {
            reject("抢杠只能荣和");
        }
        if (context.isRinshan() && context.isChankan()) {
            reject("岭上开花与抢杠不能同时成立");
        }
        if (context.isRinshan() && hand.getMelds().stream().noneMatch(m -> m.isQuad())) {
            reject("岭上开花需要有杠");
        }

        // 天和 / 地和 / 人和
        int blessings = (context.isTenhou() ? 1 : 0) + (context.isChiihou() ? 1 : 0) + (context.isRenhou() ? 1 : 0);
        if (blessings > 1) {
            reject("天和、地和、人和只能有一个");
        }
        if (context.isTenhou() && (!context.isDealer() || ron || hasCalls)) {
            reject("天和必须是庄家第一巡自摸且无副露");
        }
        if (context.isChiihou() && (context.isDealer() || ron || hasCalls)) {
            reject("地和必须是闲家第一巡自摸且无副露");
        }
        if (context.isRenhou() && (context.isDealer() || !ron || hasCalls)) {
            reject("人和必须是闲家第一巡荣和且无副露");
        }

        if (context.getHonba() < 0 || context.getRiichiSticks() < 0) {
            reject("本场数和供托不能为负数");
        }
    }

    private static void reject(String message) {
        throw new ScoringException(ScoringError.AMBIGUOUS_CONFIGURATION, message);
    }
}
