package com.riichimahjong.engine;

import com.riichimahjong.model.Hand;
import com.riichimahjong.model.WinContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 计分引擎 - 串起场况检查、拆解、役判定、符计算、取最高分和点数换算。
 * <p>
 * 引擎本身无状态，可以在多个线程间共享。
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final ContextValidator contextValidator;
    private final HandDecomposer decomposer;
    private final YakuEvaluator yakuEvaluator;
    private final FuCalculator fuCalculator;
    private final ScoreSelector scoreSelector;

    public ScoringEngine(RuleSet ruleSet) {
        this.contextValidator = new ContextValidator();
        this.decomposer = new HandDecomposer();
        this.yakuEvaluator = new YakuEvaluator(YakuRuleSet.standard(), ruleSet);
        this.fuCalculator = new FuCalculator();
        this.scoreSelector = new ScoreSelector(new PaymentTranslator(ruleSet));
    }

    public ScoringEngine() {
        this(RuleSet.defaults());
    }

    /**
     * 计算一手和牌的得点。失败不抛异常，而是返回带错误码的结果。
     */
    public ScoringResult score(Hand hand, WinContext context) {
        try {
            contextValidator.validate(hand, context);
            List<Decomposition> decompositions = decomposer.decompose(hand);

            List<ScoreCandidate> candidates = new ArrayList<>();
            for (Decomposition decomposition : decompositions) {
                YakuResult yakuResult = yakuEvaluator.evaluate(decomposition, context);
                if (!yakuResult.isScoreable()) {
                    continue;
                }
                int fu = yakuResult.isYakuman() ? 0 : fuCalculator.computeFu(decomposition, context);
                candidates.add(new ScoreCandidate(decomposition, yakuResult, fu));
            }

            ScoreBreakdown best = scoreSelector.selectBest(candidates, context);
            log.debug("手牌 {} 计分完成：{}", hand, best);
            return ScoringResult.success(best);
        } catch (ScoringException e) {
            log.debug("手牌 {} 计分失败：{} {}", hand, e.getError(), e.getMessage());
            return ScoringResult.failure(e.getError(), e.getMessage());
        }
    }
}
