package com.riichimahjong.engine;

import com.riichimahjong.model.Hand;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.MeldType;
import com.riichimahjong.model.RiichiType;
import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WinContext;
import com.riichimahjong.model.WinMethod;
import com.riichimahjong.model.Wind;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 计分引擎整体测试
 */
public class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    private static Hand hand(String concealed, String winningTile) {
        return new Hand(TileParser.parseTiles(concealed), TileParser.parseTile(winningTile));
    }

    private static WinContext context(Wind seat, Wind round, WinMethod method) {
        WinContext context = new WinContext();
        context.setSeatWind(seat);
        context.setRoundWind(round);
        context.setWinMethod(method);
        return context;
    }

    @Test
    void pinfuRon_nonDealer() {
        ScoringResult result = engine.score(hand("234m567p789s345s11z", "5p"),
                context(Wind.WEST, Wind.SOUTH, WinMethod.RON));

        assertTrue(result.isSuccess(), String.valueOf(result));
        ScoreBreakdown breakdown = result.getBreakdown();
        assertEquals(1, breakdown.getHan());
        assertEquals(30, breakdown.getFu());
        assertEquals(1, breakdown.getYaku().size());
        assertEquals(Yaku.PINFU, breakdown.getYaku().get(0).getYaku());
        assertEquals(WaitShape.RYANMEN, breakdown.getWait());
        assertEquals(1000, breakdown.getTotalPoints());
        assertEquals("30符1番", breakdown.getLabel());
    }

    @Test
    void pinfuWithDora_addsHan() {
        WinContext context = context(Wind.WEST, Wind.SOUTH, WinMethod.RON);
        context.setDoraIndicators(TileParser.parseTiles("1m"));

        ScoreBreakdown breakdown = engine.score(hand("234m567p789s345s11z", "5p"), context).getBreakdown();

        assertEquals(2, breakdown.getHan());
        assertEquals(2000, breakdown.getTotalPoints());
    }

    @Test
    void suuankouTsumo_nonDealer() {
        ScoringResult result = engine.score(hand("111m333p555s777s99m", "7s"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.TSUMO));

        assertTrue(result.isSuccess());
        ScoreBreakdown breakdown = result.getBreakdown();
        assertTrue(breakdown.isYakuman());
        assertEquals(8000, breakdown.getBasePoints());
        assertEquals(0, breakdown.getHan());
        assertEquals(0, breakdown.getFu());

        Payment payment = breakdown.getPayment();
        assertEquals(Payment.Payer.DEALER, payment.getShares().get(0).getPayer());
        assertEquals(16000, payment.getShares().get(0).getAmount());
        assertEquals(8000, payment.getShares().get(1).getAmount());
        assertEquals(8000, payment.getShares().get(2).getAmount());
        assertEquals(32000, breakdown.getTotalPoints());
    }

    @Test
    void suuankouTsumo_dealer() {
        ScoringResult result = engine.score(hand("111m333p555s777s99m", "7s"),
                context(Wind.EAST, Wind.EAST, WinMethod.TSUMO));

        assertEquals(48000, result.getBreakdown().getTotalPoints());
    }

    @Test
    void redFiveOnly_isNoYaku() {
        ScoringResult result = engine.score(hand("123m406m789p234s99p", "8p"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));

        assertFalse(result.isSuccess());
        assertTrue(result.isNoYaku());
        assertEquals(ScoringError.NO_YAKU_FOUND, result.getError());
        assertNull(result.getBreakdown());
    }

    @Test
    void kokushi_multipleDependsOnWinningTile() {
        ScoringResult thirteen = engine.score(hand("119m19p19s1234567z", "1m"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));
        assertEquals(DecompositionShape.THIRTEEN_ORPHANS, thirteen.getBreakdown().getShape());
        assertEquals(2, thirteen.getBreakdown().getYakumanMultiple());
        assertEquals(64000, thirteen.getBreakdown().getTotalPoints());

        ScoringResult single = engine.score(hand("19m19p199s1234567z", "1m"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));
        assertEquals(1, single.getBreakdown().getYakumanMultiple());
        assertEquals(32000, single.getBreakdown().getTotalPoints());
    }

    @Test
    void bestDecomposition_isChosen() {
        // 二杯口 3番40符 比 七对子 2番25符 高
        ScoringResult result = engine.score(hand("112233m445566p77z", "7z"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));

        ScoreBreakdown breakdown = result.getBreakdown();
        assertEquals(DecompositionShape.STANDARD, breakdown.getShape());
        assertEquals(3, breakdown.getHan());
        assertEquals(40, breakdown.getFu());
        assertEquals(5200, breakdown.getTotalPoints());
    }

    @Test
    void riichiOnOpenHand_isAmbiguous() {
        Meld chi = Meld.of(MeldType.CHI, new Tile(Suit.MANZU, 2));
        Hand hand = new Hand(TileParser.parseTiles("567p789s345s22p"), Collections.singletonList(chi),
                TileParser.parseTile("5p"));
        WinContext context = context(Wind.SOUTH, Wind.EAST, WinMethod.RON);
        context.setRiichi(RiichiType.RIICHI);

        ScoringResult result = engine.score(hand, context);

        assertEquals(ScoringError.AMBIGUOUS_CONFIGURATION, result.getError());
        assertFalse(result.isNoYaku());
    }

    @Test
    void haiteiRon_isAmbiguous() {
        WinContext context = context(Wind.SOUTH, Wind.EAST, WinMethod.RON);
        context.setHaitei(true);

        ScoringResult result = engine.score(hand("234m567p789s345s11z", "5p"), context);

        assertEquals(ScoringError.AMBIGUOUS_CONFIGURATION, result.getError());
    }

    @Test
    void malformedHand_isInvalidShapeResult() {
        ScoringResult result = engine.score(hand("234m567p789s11z", "2m"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));

        assertFalse(result.isSuccess());
        assertEquals(ScoringError.INVALID_HAND_SHAPE, result.getError());
    }

    @Test
    void yakumanPolicy_isConfigurable() {
        Hand hand = hand("111z222z333z555z66z", "5z");
        WinContext tsumo = context(Wind.SOUTH, Wind.EAST, WinMethod.TSUMO);

        assertEquals(2, engine.score(hand, tsumo).getBreakdown().getYakumanMultiple());

        RuleSet maxRule = RuleSet.defaults();
        maxRule.setYakumanPolicy(YakumanPolicy.MAX);
        assertEquals(1, new ScoringEngine(maxRule).score(hand, tsumo).getBreakdown().getYakumanMultiple());
    }

    @Test
    void tenhou_isYakuman() {
        WinContext context = context(Wind.EAST, Wind.EAST, WinMethod.TSUMO);
        context.setTenhou(true);

        ScoringResult result = engine.score(hand("234m567p789s345s11z", "5p"), context);

        assertTrue(result.getBreakdown().isYakuman());
        assertEquals(48000, result.getBreakdown().getTotalPoints());
    }

    @Test
    void honbaAndDeposits_areAdded() {
        WinContext context = context(Wind.WEST, Wind.SOUTH, WinMethod.RON);
        context.setHonba(1);
        context.setRiichiSticks(1);

        ScoreBreakdown breakdown = engine.score(hand("234m567p789s345s11z", "5p"), context).getBreakdown();

        assertEquals(300, breakdown.getPayment().getHonbaBonus());
        assertEquals(1000, breakdown.getPayment().getRiichiDeposit());
        assertEquals(2300, breakdown.getTotalPoints());
    }

    @Test
    void daisuushiiWithSuuankouTanki_isTripleYakuman() {
        ScoringResult result = engine.score(hand("111z222z333z444z55m", "5m"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.TSUMO));

        assertTrue(result.isSuccess(), String.valueOf(result));
        ScoreBreakdown breakdown = result.getBreakdown();
        // 大四喜 1 倍 + 四暗刻单骑 2 倍
        assertEquals(3, breakdown.getYakumanMultiple());
        assertEquals(24000, breakdown.getBasePoints());

        Payment payment = breakdown.getPayment();
        assertEquals(Payment.Payer.DEALER, payment.getShares().get(0).getPayer());
        assertEquals(48000, payment.getShares().get(0).getAmount());
        assertEquals(24000, payment.getShares().get(1).getAmount());
        assertEquals(24000, payment.getShares().get(2).getAmount());
        assertEquals(96000, breakdown.getTotalPoints());
    }

    @Test
    void daisuushiiRonOnShanpon_isSingleYakuman() {
        ScoringResult result = engine.score(hand("111z222z333z444z55m", "4z"),
                context(Wind.SOUTH, Wind.EAST, WinMethod.RON));

        ScoreBreakdown breakdown = result.getBreakdown();
        assertEquals(1, breakdown.getYakumanMultiple());
        assertEquals(32000, breakdown.getTotalPoints());
    }

    @Test
    void chankan_dropsPinfu() {
        WinContext context = context(Wind.WEST, Wind.SOUTH, WinMethod.RON);
        context.setChankan(true);

        ScoringResult result = engine.score(hand("234m567p789s345s22p", "5p"), context);

        assertTrue(result.isSuccess(), String.valueOf(result));
        ScoreBreakdown breakdown = result.getBreakdown();
        assertEquals(1, breakdown.getYaku().size());
        assertEquals(Yaku.CHANKAN, breakdown.getYaku().get(0).getYaku());
        assertEquals(1, breakdown.getHan());
        assertEquals(30, breakdown.getFu());
        assertEquals(1000, breakdown.getTotalPoints());
    }

    @Test
    void rinshanKaihou_scoresWithDeclaredKan() {
        WinContext context = context(Wind.WEST, Wind.SOUTH, WinMethod.TSUMO);
        context.setRinshan(true);
        Meld ankan = Meld.of(MeldType.ANKAN, new Tile(Suit.SOUZU, 9));
        Hand hand = new Hand(TileParser.parseTiles("234m567p345s11z"), Collections.singletonList(ankan),
                TileParser.parseTile("5p"));

        ScoringResult result = engine.score(hand, context);

        assertTrue(result.isSuccess(), String.valueOf(result));
        ScoreBreakdown breakdown = result.getBreakdown();
        assertTrue(breakdown.getYaku().stream().anyMatch(e -> e.getYaku() == Yaku.RINSHAN_KAIHOU));
        assertTrue(breakdown.getYaku().stream().noneMatch(e -> e.getYaku() == Yaku.PINFU));
        assertEquals(2, breakdown.getHan());
    }
}
