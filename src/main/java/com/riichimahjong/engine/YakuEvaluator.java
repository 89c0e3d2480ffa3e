package com.riichimahjong.engine;

import com.riichimahjong.model.WinContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 役判定器：对一个拆解 + 场况给出成立的役和宝牌番数。
 * <p>
 * 有役满成立时只保留役满，普通役与宝牌都不再计算。
 */
public class YakuEvaluator {

    private static final Logger log = LoggerFactory.getLogger(YakuEvaluator.class);

    private final YakuRuleSet yakuRules;
    private final RuleSet ruleSet;

    public YakuEvaluator(YakuRuleSet yakuRules, RuleSet ruleSet) {
        this.yakuRules = yakuRules;
        this.ruleSet = ruleSet;
    }

    public YakuEvaluator() {
        this(YakuRuleSet.standard(), RuleSet.defaults());
    }

    public YakuResult evaluate(Decomposition decomposition, WinContext context) {
        HandView view = new HandView(decomposition, context);
        Set<Yaku> matched = yakuRules.match(view);

        List<YakuEntry> yakuman = new ArrayList<>();
        int multipleSum = 0;
        int multipleMax = 0;
        for (Yaku yaku : matched) {
            if (!yaku.isYakuman()) {
                continue;
            }
            int multiple = ruleSet.isDoubleYakuman() ? yaku.getYakumanMultiple() : 1;
            yakuman.add(new YakuEntry(yaku, 13 * multiple));
            multipleSum += multiple;
            multipleMax = Math.max(multipleMax, multiple);
        }
        if (!yakuman.isEmpty()) {
            int multiple = ruleSet.getYakumanPolicy() == YakumanPolicy.MAX ? multipleMax : multipleSum;
            log.debug("役满成立：{} => {} 倍", yakuman, multiple);
            return YakuResult.yakuman(yakuman, multiple);
        }

        boolean closed = decomposition.isClosedHand();
        List<YakuEntry> entries = new ArrayList<>();
        for (Yaku yaku : matched) {
            entries.add(new YakuEntry(yaku, yaku.getHan(closed)));
        }

        List<YakuEntry> dora = new ArrayList<>();
        int doraCount = DoraCounter.countDora(decomposition.getTiles(), context.getDoraIndicators());
        if (doraCount > 0) {
            dora.add(new YakuEntry(Yaku.DORA, doraCount));
        }
        int redCount = DoraCounter.countRed(decomposition.getTiles());
        if (redCount > 0) {
            dora.add(new YakuEntry(Yaku.AKA_DORA, redCount));
        }
        if (context.getRiichi().isDeclared()) {
            int uraCount = DoraCounter.countDora(decomposition.getTiles(), context.getUraDoraIndicators());
            if (uraCount > 0) {
                dora.add(new YakuEntry(Yaku.URA_DORA, uraCount));
            }
        }

        YakuResult result = YakuResult.regular(entries, dora);
        log.debug("拆解 {} => {}", decomposition, result);
        return result;
    }
}
