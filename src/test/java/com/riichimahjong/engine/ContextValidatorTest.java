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
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ContextValidatorTest {

    private final ContextValidator validator = new ContextValidator();
    private final Hand closedHand = new Hand(TileParser.parseTiles("234m567p789s345s11z"), TileParser.parseTile("5p"));

    private void assertRejected(Hand hand, WinMethod method, Consumer<WinContext> setup) {
        WinContext context = new WinContext();
        context.setWinMethod(method);
        setup.accept(context);
        ScoringException e = assertThrows(ScoringException.class, () -> validator.validate(hand, context));
        assertEquals(ScoringError.AMBIGUOUS_CONFIGURATION, e.getError());
    }

    @Test
    void testValidContexts() {
        WinContext ron = new WinContext();
        ron.setRiichi(RiichiType.RIICHI);
        ron.setIppatsu(true);
        ron.setHoutei(true);
        assertDoesNotThrow(() -> validator.validate(closedHand, ron));

        WinContext tsumo = new WinContext();
        tsumo.setWinMethod(WinMethod.TSUMO);
        tsumo.setHaitei(true);
        assertDoesNotThrow(() -> validator.validate(closedHand, tsumo));
    }

    @Test
    void testIppatsuWithoutRiichi() {
        assertRejected(closedHand, WinMethod.RON, c -> c.setIppatsu(true));
    }

    @Test
    void testRiichiOnOpenHand() {
        Meld pon = Meld.of(MeldType.PON, new Tile(Suit.DRAGON, 1));
        Hand open = new Hand(TileParser.parseTiles("234m567p789s11z"), Collections.singletonList(pon),
                TileParser.parseTile("2m"));
        assertRejected(open, WinMethod.RON, c -> c.setRiichi(RiichiType.DOUBLE_RIICHI));
    }

    @Test
    void testLastTileFlagsMustMatchWinMethod() {
        assertRejected(closedHand, WinMethod.RON, c -> c.setHaitei(true));
        assertRejected(closedHand, WinMethod.TSUMO, c -> c.setHoutei(true));
        assertRejected(closedHand, WinMethod.TSUMO, c -> {
            c.setHaitei(true);
            c.setHoutei(true);
        });
    }

    @Test
    void testKanFlags() {
        assertRejected(closedHand, WinMethod.RON, c -> c.setRinshan(true));
        assertRejected(closedHand, WinMethod.TSUMO, c -> c.setChankan(true));
        // 没有杠不能岭上开花
        assertRejected(closedHand, WinMethod.TSUMO, c -> c.setRinshan(true));
    }

    @Test
    void testRinshanWithKan() {
        Meld ankan = Meld.of(MeldType.ANKAN, new Tile(Suit.SOUZU, 9));
        Hand hand = new Hand(TileParser.parseTiles("234m567p345s11z"), Collections.singletonList(ankan),
                TileParser.parseTile("5p"));
        WinContext context = new WinContext();
        context.setWinMethod(WinMethod.TSUMO);
        context.setRinshan(true);

        assertDoesNotThrow(() -> validator.validate(hand, context));
    }

    @Test
    void testBlessings() {
        // 天和只能是庄家自摸
        assertRejected(closedHand, WinMethod.TSUMO, c -> c.setTenhou(true));
        assertRejected(closedHand, WinMethod.RON, c -> {
            c.setSeatWind(Wind.EAST);
            c.setTenhou(true);
        });
        // 地和不能是庄家
        assertRejected(closedHand, WinMethod.TSUMO, c -> {
            c.setSeatWind(Wind.EAST);
            c.setChiihou(true);
        });
        // 人和只能荣和
        assertRejected(closedHand, WinMethod.TSUMO, c -> c.setRenhou(true));
        assertRejected(closedHand, WinMethod.TSUMO, c -> {
            c.setChiihou(true);
            c.setRenhou(true);
        });
    }

    @Test
    void testNegativeCounters() {
        assertRejected(closedHand, WinMethod.RON, c -> c.setHonba(-1));
        assertRejected(closedHand, WinMethod.RON, c -> c.setRiichiSticks(-1));
    }
}
