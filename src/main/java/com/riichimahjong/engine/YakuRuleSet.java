package com.riichimahjong.engine;

import com.riichimahjong.model.RiichiType;
import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 役的规则表。每条规则独立判定，最后按“高位役覆盖低位役”的关系去掉被包含的役。
 */
public class YakuRuleSet {

    private final List<YakuRule> rules;
    private final Map<Yaku, Set<Yaku>> suppressions;

    public YakuRuleSet(List<YakuRule> rules, Map<Yaku, Set<Yaku>> suppressions) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.suppressions = suppressions;
    }

    /**
     * 判定所有规则，返回成立的役（已去掉被覆盖的役）
     */
    public Set<Yaku> match(HandView view) {
        Set<Yaku> matched = EnumSet.noneOf(Yaku.class);
        for (YakuRule rule : rules) {
            if (rule.matches(view)) {
                matched.add(rule.getYaku());
            }
        }
        for (Map.Entry<Yaku, Set<Yaku>> entry : suppressions.entrySet()) {
            if (matched.contains(entry.getKey())) {
                matched.removeAll(entry.getValue());
            }
        }
        return matched;
    }

    /**
     * 标准规则表
     */
    public static YakuRuleSet standard() {
        List<YakuRule> rules = new ArrayList<>();

        // --- 役满 ---
        rules.add(new YakuRule(Yaku.TENHOU, v -> v.getContext().isTenhou()));
        rules.add(new YakuRule(Yaku.CHIIHOU, v -> v.getContext().isChiihou()));
        rules.add(new YakuRule(Yaku.RENHOU, v -> v.getContext().isRenhou()));
        rules.add(new YakuRule(Yaku.KOKUSHI_MUSOU, v -> v.getWait() == WaitShape.KOKUSHI_SINGLE));
        rules.add(new YakuRule(Yaku.KOKUSHI_MUSOU_13, v -> v.getWait() == WaitShape.KOKUSHI_THIRTEEN));
        rules.add(new YakuRule(Yaku.SUUANKOU,
                v -> v.getConcealedTripletCount() == 4 && v.getWait() != WaitShape.TANKI));
        rules.add(new YakuRule(Yaku.SUUANKOU_TANKI,
                v -> v.getConcealedTripletCount() == 4 && v.getWait() == WaitShape.TANKI));
        rules.add(new YakuRule(Yaku.DAISANGEN, v -> v.countTriplets(Tile::isDragon) == 3));
        rules.add(new YakuRule(Yaku.SHOUSUUSHII,
                v -> v.countTriplets(Tile::isWind) == 3 && v.pairMatches(Tile::isWind)));
        rules.add(new YakuRule(Yaku.DAISUUSHII, v -> v.countTriplets(Tile::isWind) == 4));
        rules.add(new YakuRule(Yaku.TSUUIISOU, v -> v.allTiles(Tile::isHonor)));
        rules.add(new YakuRule(Yaku.CHINROUTOU, v -> v.allTiles(Tile::isTerminal)));
        rules.add(new YakuRule(Yaku.RYUUIISOU, v -> v.allTiles(Tile::isGreen)));
        rules.add(new YakuRule(Yaku.CHUUREN_POUTOU, v -> {
            int extra = chuurenExtraRank(v);
            return extra > 0 && extra != v.getDecomposition().getWinningTile().getRank();
        }));
        rules.add(new YakuRule(Yaku.JUNSEI_CHUUREN_POUTOU, v -> {
            int extra = chuurenExtraRank(v);
            return extra > 0 && extra == v.getDecomposition().getWinningTile().getRank();
        }));
        rules.add(new YakuRule(Yaku.SUUKANTSU, v -> v.getQuadCount() == 4));

        // --- 场况役 ---
        rules.add(new YakuRule(Yaku.RIICHI, v -> v.getContext().getRiichi() == RiichiType.RIICHI));
        rules.add(new YakuRule(Yaku.DOUBLE_RIICHI, v -> v.getContext().getRiichi() == RiichiType.DOUBLE_RIICHI));
        rules.add(new YakuRule(Yaku.IPPATSU,
                v -> v.getContext().isIppatsu() && v.getContext().getRiichi().isDeclared()));
        rules.add(new YakuRule(Yaku.MENZEN_TSUMO, v -> v.getContext().isTsumo()));
        rules.add(new YakuRule(Yaku.HAITEI, v -> v.getContext().isHaitei() && v.getContext().isTsumo()));
        rules.add(new YakuRule(Yaku.HOUTEI, v -> v.getContext().isHoutei() && v.getContext().isRon()));
        rules.add(new YakuRule(Yaku.RINSHAN_KAIHOU, v -> v.getContext().isRinshan() && v.getContext().isTsumo()));
        rules.add(new YakuRule(Yaku.CHANKAN, v -> v.getContext().isChankan() && v.getContext().isRon()));

        // --- 牌型役 ---
        rules.add(new YakuRule(Yaku.CHIITOITSU, v -> v.isShape(DecompositionShape.SEVEN_PAIRS)));
        rules.add(new YakuRule(Yaku.PINFU, v -> v.isStandard()
                && v.getRuns().size() == 4
                && !v.pairMatches(v::isYakuhaiTile)
                && v.getWait() == WaitShape.RYANMEN));
        rules.add(new YakuRule(Yaku.TANYAO, v -> v.allTiles(Tile::isSimple)));
        rules.add(new YakuRule(Yaku.YAKUHAI_HAKU, v -> v.hasTripletOf(new Tile(Suit.DRAGON, 1))));
        rules.add(new YakuRule(Yaku.YAKUHAI_HATSU, v -> v.hasTripletOf(new Tile(Suit.DRAGON, 2))));
        rules.add(new YakuRule(Yaku.YAKUHAI_CHUN, v -> v.hasTripletOf(new Tile(Suit.DRAGON, 3))));
        rules.add(new YakuRule(Yaku.YAKUHAI_SEAT_WIND,
                v -> v.hasTripletOf(v.getContext().getSeatWind().toTile())));
        rules.add(new YakuRule(Yaku.YAKUHAI_ROUND_WIND,
                v -> v.hasTripletOf(v.getContext().getRoundWind().toTile())));
        rules.add(new YakuRule(Yaku.IIPEIKOU, v -> v.isStandard() && v.countIdenticalRunPairs() == 1));
        rules.add(new YakuRule(Yaku.RYANPEIKOU, v -> v.isStandard() && v.countIdenticalRunPairs() == 2));
        rules.add(new YakuRule(Yaku.SANSHOKU_DOUJUN, v -> HandView.coversThreeSuits(v.getRuns())));
        rules.add(new YakuRule(Yaku.ITTSU, YakuRuleSet::isIttsu));
        rules.add(new YakuRule(Yaku.TOITOI, v -> v.isStandard() && v.getTripletsAndQuads().size() == 4));
        rules.add(new YakuRule(Yaku.SANANKOU, v -> v.getConcealedTripletCount() == 3));
        rules.add(new YakuRule(Yaku.SANSHOKU_DOUKOU, v -> HandView.coversThreeSuits(v.getTripletsAndQuads())));
        rules.add(new YakuRule(Yaku.SANKANTSU, v -> v.getQuadCount() == 3));
        rules.add(new YakuRule(Yaku.SHOUSANGEN,
                v -> v.countTriplets(Tile::isDragon) == 2 && v.pairMatches(Tile::isDragon)));
        rules.add(new YakuRule(Yaku.HONROUTOU, v -> v.allTiles(Tile::isTerminalOrHonor)
                && v.anyTile(Tile::isHonor) && v.anyTile(Tile::isTerminal)));
        rules.add(new YakuRule(Yaku.CHANTA, v -> isOutsideHand(v) && v.anyTile(Tile::isHonor)));
        rules.add(new YakuRule(Yaku.JUNCHAN, v -> isOutsideHand(v) && !v.anyTile(Tile::isHonor)));
        rules.add(new YakuRule(Yaku.HONITSU,
                v -> v.getSingleNumberSuit() != null && v.anyTile(Tile::isHonor)));
        rules.add(new YakuRule(Yaku.CHINITSU,
                v -> v.getSingleNumberSuit() != null && !v.anyTile(Tile::isHonor)));

        Map<Yaku, Set<Yaku>> suppressions = new EnumMap<>(Yaku.class);
        suppressions.put(Yaku.RYANPEIKOU, EnumSet.of(Yaku.IIPEIKOU));
        suppressions.put(Yaku.SUUANKOU, EnumSet.of(Yaku.SANANKOU));
        suppressions.put(Yaku.SUUANKOU_TANKI, EnumSet.of(Yaku.SANANKOU));
        suppressions.put(Yaku.DAISANGEN, EnumSet.of(Yaku.SHOUSANGEN));
        // 抢杠、岭上开花不计平和
        suppressions.put(Yaku.CHANKAN, EnumSet.of(Yaku.PINFU));
        suppressions.put(Yaku.RINSHAN_KAIHOU, EnumSet.of(Yaku.PINFU));

        return new YakuRuleSet(rules, suppressions);
    }

    /**
     * 一气通贯：同一花色的 123、456、789
     */
    private static boolean isIttsu(HandView view) {
        for (Suit suit : new Suit[]{Suit.MANZU, Suit.PINZU, Suit.SOUZU}) {
            boolean low = false;
            boolean middle = false;
            boolean high = false;
            for (Group run : view.getRuns()) {
                Tile first = run.getFirst();
                if (first.getSuit() != suit) {
                    continue;
                }
                low |= first.getRank() == 1;
                middle |= first.getRank() == 4;
                high |= first.getRank() == 7;
            }
            if (low && middle && high) {
                return true;
            }
        }
        return false;
    }

    /**
     * 全带幺：每一组（含雀头）都带幺九牌，且至少有一个顺子（否则是混老头/清老头）
     */
    private static boolean isOutsideHand(HandView view) {
        if (!view.isStandard() || view.getRuns().isEmpty()) {
            return false;
        }
        for (Group group : view.getDecomposition().getGroups()) {
            if (!group.hasTerminalOrHonor()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 九莲宝灯：门前清一色，1112345678999 + 任意一张同花色。
     * 返回多出来的那一张的数值，不成立时返回 0。
     */
    static int chuurenExtraRank(HandView view) {
        if (!view.isStandard() || !view.isClosed() || view.getQuadCount() > 0) {
            return 0;
        }
        Suit suit = view.getSingleNumberSuit();
        if (suit == null || view.anyTile(Tile::isHonor)) {
            return 0;
        }
        int[] ranks = new int[10];
        for (Tile tile : view.getKinds()) {
            ranks[tile.getRank()]++;
        }
        int extra = 0;
        for (int rank = 1; rank <= 9; rank++) {
            int base = (rank == 1 || rank == 9) ? 3 : 1;
            int surplus = ranks[rank] - base;
            if (surplus < 0 || surplus > 1) {
                return 0;
            }
            if (surplus == 1) {
                if (extra != 0) {
                    return 0;
                }
                extra = rank;
            }
        }
        return extra;
    }
}
