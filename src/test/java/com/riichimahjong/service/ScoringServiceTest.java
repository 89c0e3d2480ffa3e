package com.riichimahjong.service;

import com.riichimahjong.engine.ScoringEngine;
import com.riichimahjong.engine.ScoringError;
import com.riichimahjong.engine.ScoringResult;
import com.riichimahjong.model.Hand;
import com.riichimahjong.model.MeldType;
import com.riichimahjong.model.RiichiType;
import com.riichimahjong.model.WinContext;
import com.riichimahjong.model.WinMethod;
import com.riichimahjong.model.Wind;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class ScoringServiceTest {

    private final ScoringService service = new ScoringService(new ScoringEngine());

    private static ScoreRequest pinfuRequest() {
        ScoreRequest request = new ScoreRequest();
        request.setConcealed("234m567p789s345s11z");
        request.setWinningTile("5p");
        request.setSeatWind("west");
        request.setRoundWind("SOUTH");
        request.setWinMethod("RON");
        return request;
    }

    @Test
    void testDefaultsWhenFieldsMissing() {
        ScoreRequest request = new ScoreRequest();
        request.setConcealed("234m567p789s345s11z");
        request.setWinningTile("5p");

        WinContext context = service.toContext(request);

        assertEquals(Wind.SOUTH, context.getSeatWind());
        assertEquals(Wind.EAST, context.getRoundWind());
        assertEquals(WinMethod.RON, context.getWinMethod());
        assertEquals(RiichiType.NONE, context.getRiichi());
        assertTrue(context.getDoraIndicators().isEmpty());
    }

    @Test
    void testMeldConversion() {
        ScoreRequest.MeldRequest pon = new ScoreRequest.MeldRequest();
        pon.setType("pon");
        pon.setTiles("555z");
        ScoreRequest request = new ScoreRequest();
        request.setConcealed("234m567p789s11z");
        request.setWinningTile("2m");
        request.setMelds(Collections.singletonList(pon));

        Hand hand = service.toHand(request);

        assertEquals(1, hand.getMelds().size());
        assertEquals(MeldType.PON, hand.getMelds().get(0).getType());
        assertFalse(hand.isConcealed());
    }

    @Test
    void testScorePinfu() {
        ScoringResult result = service.score(pinfuRequest());

        assertTrue(result.isSuccess());
        assertEquals(1000, result.getBreakdown().getTotalPoints());
    }

    @Test
    void testScoringFailureIsReturned() {
        ScoreRequest request = pinfuRequest();
        request.setHaitei(true);

        ScoringResult result = service.score(request);

        assertFalse(result.isSuccess());
        assertEquals(ScoringError.AMBIGUOUS_CONFIGURATION, result.getError());
    }

    @Test
    void testInvalidInputThrows() {
        ScoreRequest badWind = pinfuRequest();
        badWind.setSeatWind("CENTER");
        assertThrows(IllegalArgumentException.class, () -> service.score(badWind));

        ScoreRequest badTile = pinfuRequest();
        badTile.setWinningTile("8z");
        assertThrows(IllegalArgumentException.class, () -> service.score(badTile));

        ScoreRequest missing = new ScoreRequest();
        assertThrows(IllegalArgumentException.class, () -> service.score(missing));
    }
}
