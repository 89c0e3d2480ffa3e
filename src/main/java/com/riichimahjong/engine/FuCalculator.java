package com.riichimahjong.engine;

import com.riichimahjong.model.WinContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 符计算（只用于非役满的拆解）
 * <ul>
 *   <li>副底 20 符；门前荣和 +10；自摸 +2（平和自摸不加）</li>
 *   <li>刻子：中张明 2 / 暗 4，幺九明 4 / 暗 8；杠子为刻子的 4 倍</li>
 *   <li>嵌张、边张、单骑 +2</li>
 *   <li>雀头：三元牌、自风、场风各 +2（连风 4 符）</li>
 *   <li>副露且无任何加符的荣和记 30 符</li>
 *   <li>七对子固定 25 符，其余向上取整到 10 符</li>
 * </ul>
 */
public class FuCalculator {

    private static final Logger log = LoggerFactory.getLogger(FuCalculator.class);

    public static final int CHIITOITSU_FU = 25;

    public int computeFu(Decomposition decomposition, WinContext context) {
        switch (decomposition.getShape()) {
            case SEVEN_PAIRS:
                return CHIITOITSU_FU;
            case THIRTEEN_ORPHANS:
                // 国士无双总是役满，不会走到这里
                throw new IllegalStateException("国士无双不计符");
            default:
                return computeStandardFu(decomposition, context);
        }
    }

    private int computeStandardFu(Decomposition decomposition, WinContext context) {
        boolean ron = context.isRon();
        int groupFu = 0;
        for (Group set : decomposition.getSets()) {
            groupFu += setFu(set, decomposition.countsAsConcealed(set, ron));
        }
        int waitFu = decomposition.getWait().scoresFu() ? 2 : 0;
        int pairFu = pairFu(decomposition.getPair(), context);

        boolean pinfuShape = decomposition.isClosedHand() && groupFu == 0 && waitFu == 0 && pairFu == 0
                && decomposition.getWait() == WaitShape.RYANMEN;

        int fu = 20 + groupFu + waitFu + pairFu;
        if (ron && decomposition.isClosedHand()) {
            fu += 10;
        }
        if (!ron && !pinfuShape) {
            fu += 2;
        }
        if (!decomposition.isClosedHand() && fu == 20) {
            fu = 30;
        }

        int rounded = roundUpToTen(fu);
        log.debug("符：面子 {} + 听牌 {} + 雀头 {} => {} 符（取整 {}）", groupFu, waitFu, pairFu, fu, rounded);
        return rounded;
    }

    static int setFu(Group set, boolean concealed) {
        if (set.isRun()) {
            return 0;
        }
        int fu = 2;
        if (set.getFirst().isTerminalOrHonor()) {
            fu *= 2;
        }
        if (concealed) {
            fu *= 2;
        }
        if (set.getType() == GroupType.QUAD) {
            fu *= 4;
        }
        return fu;
    }

    static int pairFu(Group pair, WinContext context) {
        int fu = 0;
        if (pair.getFirst().isDragon()) {
            fu += 2;
        }
        if (context.getSeatWind().toTile().isSameAs(pair.getFirst())) {
            fu += 2;
        }
        if (context.getRoundWind().toTile().isSameAs(pair.getFirst())) {
            fu += 2;
        }
        return fu;
    }

    static int roundUpToTen(int fu) {
        return (fu + 9) / 10 * 10;
    }
}
