package com.riichimahjong.engine;

import com.riichimahjong.model.Hand;
import com.riichimahjong.model.WinContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScoreSelectorTest {

    private final ScoreSelector selector = new ScoreSelector(new PaymentTranslator());
    private final WinContext context = new WinContext();
    private Decomposition first;
    private Decomposition second;

    @BeforeEach
    void setUp() {
        Hand hand = new Hand(TileParser.parseTiles("111222333m456p77s"), TileParser.parseTile("3m"));
        List<Decomposition> decompositions = new HandDecomposer().decompose(hand);
        first = decompositions.get(0);
        second = decompositions.get(1);
    }

    private static YakuResult regular(int yakuHan, int doraHan) {
        List<YakuEntry> dora = doraHan > 0
                ? Collections.singletonList(new YakuEntry(Yaku.DORA, doraHan))
                : Collections.<YakuEntry>emptyList();
        return YakuResult.regular(Collections.singletonList(new YakuEntry(Yaku.RIICHI, yakuHan)), dora);
    }

    @Test
    void yakuman_outranksAnyRegularHand() {
        ScoreCandidate huge = new ScoreCandidate(first, regular(6, 6), 110);
        ScoreCandidate yakuman = new ScoreCandidate(second,
                YakuResult.yakuman(Collections.singletonList(new YakuEntry(Yaku.SUUANKOU, 13)), 1), 0);

        ScoreBreakdown best = selector.selectBest(Arrays.asList(huge, yakuman), context);

        assertTrue(best.isYakuman());
        assertEquals(32000, best.getTotalPoints());
    }

    @Test
    void largerYakumanMultiple_wins() {
        ScoreCandidate single = new ScoreCandidate(first,
                YakuResult.yakuman(Collections.singletonList(new YakuEntry(Yaku.SUUANKOU, 13)), 1), 0);
        ScoreCandidate doubled = new ScoreCandidate(second,
                YakuResult.yakuman(Collections.singletonList(new YakuEntry(Yaku.SUUANKOU_TANKI, 26)), 2), 0);

        assertEquals(2, selector.selectBest(Arrays.asList(single, doubled), context).getYakumanMultiple());
    }

    @Test
    void regularHands_rankByHanThenFu() {
        ScoreCandidate threeHan30 = new ScoreCandidate(first, regular(3, 0), 30);
        ScoreCandidate twoHan70 = new ScoreCandidate(first, regular(2, 0), 70);
        ScoreCandidate threeHan40 = new ScoreCandidate(second, regular(2, 1), 40);

        ScoreBreakdown best = selector.selectBest(Arrays.asList(threeHan30, twoHan70, threeHan40), context);

        assertEquals(3, best.getHan());
        assertEquals(40, best.getFu());
        assertEquals(second.toString(), best.getDecomposition());
    }

    @Test
    void ties_keepFirstCandidate() {
        ScoreCandidate a = new ScoreCandidate(first, regular(1, 0), 30);
        ScoreCandidate b = new ScoreCandidate(second, regular(1, 0), 30);

        assertEquals(first.toString(), selector.selectBest(Arrays.asList(a, b), context).getDecomposition());
    }

    @Test
    void selection_isIdempotent() {
        List<ScoreCandidate> candidates = new ArrayList<>();
        candidates.add(new ScoreCandidate(first, regular(2, 1), 40));
        candidates.add(new ScoreCandidate(second, regular(3, 0), 40));

        ScoreBreakdown once = selector.selectBest(candidates, context);
        ScoreBreakdown twice = selector.selectBest(candidates, context);

        assertEquals(once.getDecomposition(), twice.getDecomposition());
        assertEquals(once.getTotalPoints(), twice.getTotalPoints());
        assertEquals(once.getLabel(), twice.getLabel());
    }

    @Test
    void emptyCandidates_isNoYaku() {
        ScoringException e = assertThrows(ScoringException.class,
                () -> selector.selectBest(Collections.<ScoreCandidate>emptyList(), context));
        assertEquals(ScoringError.NO_YAKU_FOUND, e.getError());
    }
}
