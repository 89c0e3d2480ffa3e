package com.riichimahjong.engine;

import com.riichimahjong.model.WinContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * 在所有候选中选出得分最高的一个：
 * 役满优先（倍数大者优先），其余按（番, 符）从大到小。并列时保留先出现的候选。
 */
public class ScoreSelector {

    private static final Logger log = LoggerFactory.getLogger(ScoreSelector.class);

    static final Comparator<ScoreCandidate> RANKING = Comparator
            .comparing(ScoreCandidate::isYakuman)
            .thenComparingInt(c -> c.getYakuResult().getYakumanMultiple())
            .thenComparingInt(ScoreCandidate::getHan)
            .thenComparingInt(ScoreCandidate::getFu);

    private final PaymentTranslator paymentTranslator;

    public ScoreSelector(PaymentTranslator paymentTranslator) {
        this.paymentTranslator = paymentTranslator;
    }

    public ScoreBreakdown selectBest(List<ScoreCandidate> candidates, WinContext context) {
        if (candidates == null || candidates.isEmpty()) {
            throw new ScoringException(ScoringError.NO_YAKU_FOUND);
        }

        ScoreCandidate best = null;
        for (ScoreCandidate candidate : candidates) {
            if (best == null || RANKING.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        log.debug("{} 个候选中选出：{}", candidates.size(), best);

        Payment payment = paymentTranslator.translate(best.getFu(), best.getHan(),
                best.getYakuResult().getYakumanMultiple(), context);
        return new ScoreBreakdown(best, payment);
    }
}
