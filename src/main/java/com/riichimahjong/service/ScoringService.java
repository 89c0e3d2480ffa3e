package com.riichimahjong.service;

import com.riichimahjong.engine.ScoringEngine;
import com.riichimahjong.engine.ScoringResult;
import com.riichimahjong.engine.TileParser;
import com.riichimahjong.model.Hand;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.MeldType;
import com.riichimahjong.model.RiichiType;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WinContext;
import com.riichimahjong.model.WinMethod;
import com.riichimahjong.model.Wind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 计分服务：把请求转换成手牌和场况，交给计分引擎
 */
@Service
public class ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final ScoringEngine scoringEngine;

    public ScoringService(ScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    /**
     * 计分。牌码或枚举值写错时抛出 IllegalArgumentException。
     */
    public ScoringResult score(ScoreRequest request) {
        Hand hand = toHand(request);
        WinContext context = toContext(request);

        ScoringResult result = scoringEngine.score(hand, context);
        if (result.isSuccess()) {
            log.info("计分成功：{} {} => {}", hand, context.getWinMethod(), result.getBreakdown().getLabel());
        } else {
            log.warn("计分失败：{} => {} {}", hand, result.getError(), result.getMessage());
        }
        return result;
    }

    Hand toHand(ScoreRequest request) {
        if (request.getConcealed() == null || request.getWinningTile() == null) {
            throw new IllegalArgumentException("缺少手牌或和了牌");
        }
        List<Tile> concealed = TileParser.parseTiles(request.getConcealed());
        Tile winningTile = TileParser.parseTile(request.getWinningTile());

        List<Meld> melds = new ArrayList<>();
        if (request.getMelds() != null) {
            for (ScoreRequest.MeldRequest meld : request.getMelds()) {
                MeldType type = parseEnum(MeldType.class, meld.getType(), null);
                if (type == null || meld.getTiles() == null) {
                    throw new IllegalArgumentException("副露缺少类型或牌");
                }
                melds.add(new Meld(type, TileParser.parseTiles(meld.getTiles())));
            }
        }
        return new Hand(concealed, melds, winningTile);
    }

    WinContext toContext(ScoreRequest request) {
        WinContext context = new WinContext();
        context.setSeatWind(parseEnum(Wind.class, request.getSeatWind(), context.getSeatWind()));
        context.setRoundWind(parseEnum(Wind.class, request.getRoundWind(), context.getRoundWind()));
        context.setWinMethod(parseEnum(WinMethod.class, request.getWinMethod(), context.getWinMethod()));
        context.setRiichi(parseEnum(RiichiType.class, request.getRiichi(), context.getRiichi()));
        context.setIppatsu(request.isIppatsu());
        context.setHaitei(request.isHaitei());
        context.setHoutei(request.isHoutei());
        context.setRinshan(request.isRinshan());
        context.setChankan(request.isChankan());
        context.setTenhou(request.isTenhou());
        context.setChiihou(request.isChiihou());
        context.setRenhou(request.isRenhou());
        context.setDoraIndicators(parseOptionalTiles(request.getDoraIndicators()));
        context.setUraDoraIndicators(parseOptionalTiles(request.getUraDoraIndicators()));
        context.setHonba(request.getHonba());
        context.setRiichiSticks(request.getRiichiSticks());
        return context;
    }

    private static List<Tile> parseOptionalTiles(String notation) {
        if (notation == null || notation.isBlank()) {
            return Collections.emptyList();
        }
        return TileParser.parseTiles(notation);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("无效的 " + type.getSimpleName() + "：" + value, e);
        }
    }
}
