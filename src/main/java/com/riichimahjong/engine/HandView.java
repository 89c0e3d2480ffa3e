package com.riichimahjong.engine;

import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WinContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 役判定用的视图：一个拆解 + 场况，预先整理好各条规则要用的事实
 */
public final class HandView {

    private final Decomposition decomposition;
    private final WinContext context;
    private final List<Tile> kinds;
    private final List<Group> runs = new ArrayList<>();
    private final List<Group> tripletsAndQuads = new ArrayList<>();
    private int quadCount;
    private int concealedTripletCount;

    public HandView(Decomposition decomposition, WinContext context) {
        this.decomposition = decomposition;
        this.context = context;

        List<Tile> all = new ArrayList<>();
        for (Tile tile : decomposition.getTiles()) {
            all.add(tile.kind());
        }
        this.kinds = Collections.unmodifiableList(all);

        for (Group set : decomposition.getSets()) {
            if (set.isRun()) {
                runs.add(set);
                continue;
            }
            tripletsAndQuads.add(set);
            if (set.getType() == GroupType.QUAD) {
                quadCount++;
            }
            if (decomposition.countsAsConcealed(set, context.isRon())) {
                concealedTripletCount++;
            }
        }
    }

    public Decomposition getDecomposition() {
        return decomposition;
    }

    public WinContext getContext() {
        return context;
    }

    public boolean isStandard() {
        return decomposition.isStandard();
    }

    public boolean isShape(DecompositionShape shape) {
        return decomposition.getShape() == shape;
    }

    public boolean isClosed() {
        return decomposition.isClosedHand();
    }

    public WaitShape getWait() {
        return decomposition.getWait();
    }

    public Group getPair() {
        return decomposition.getPair();
    }

    public List<Group> getRuns() {
        return runs;
    }

    public List<Group> getTripletsAndQuads() {
        return tripletsAndQuads;
    }

    public int getQuadCount() {
        return quadCount;
    }

    /**
     * 暗刻数（暗杠计入，荣和完成的刻子不计）
     */
    public int getConcealedTripletCount() {
        return concealedTripletCount;
    }

    /**
     * 手中全部牌的种类（杠子计 4 张）
     */
    public List<Tile> getKinds() {
        return kinds;
    }

    public boolean allTiles(Predicate<Tile> predicate) {
        for (Tile tile : kinds) {
            if (!predicate.test(tile)) {
                return false;
            }
        }
        return true;
    }

    public boolean anyTile(Predicate<Tile> predicate) {
        for (Tile tile : kinds) {
            if (predicate.test(tile)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 役牌：三元牌、自风、场风
     */
    public boolean isYakuhaiTile(Tile tile) {
        return tile.isDragon() || context.getSeatWind().toTile().isSameAs(tile)
                || context.getRoundWind().toTile().isSameAs(tile);
    }

    public boolean hasTripletOf(Tile tile) {
        for (Group group : tripletsAndQuads) {
            if (group.getFirst().isSameAs(tile)) {
                return true;
            }
        }
        return false;
    }

    public int countTriplets(Predicate<Tile> predicate) {
        int count = 0;
        for (Group group : tripletsAndQuads) {
            if (predicate.test(group.getFirst())) {
                count++;
            }
        }
        return count;
    }

    public boolean pairMatches(Predicate<Tile> predicate) {
        Group pair = decomposition.getPair();
        return pair != null && predicate.test(pair.getFirst());
    }

    /**
     * 手中出现的唯一一种数牌花色；没有数牌或有多种数牌时返回 null
     */
    public Suit getSingleNumberSuit() {
        Suit suit = null;
        for (Tile tile : kinds) {
            if (!tile.isNumber()) {
                continue;
            }
            if (suit == null) {
                suit = tile.getSuit();
            } else if (suit != tile.getSuit()) {
                return null;
            }
        }
        return suit;
    }

    /**
     * 相同顺子成对的组数（一杯口为 1，二杯口为 2）
     */
    public int countIdenticalRunPairs() {
        int[] starts = new int[Tile.KIND_COUNT];
        for (Group run : runs) {
            starts[run.getFirst().getIndex()]++;
        }
        int pairs = 0;
        for (int count : starts) {
            pairs += count / 2;
        }
        return pairs;
    }

    /**
     * 同一数值在万、筒、索三种花色都出现
     */
    public static boolean coversThreeSuits(List<Group> groups) {
        for (int rank = 1; rank <= 9; rank++) {
            boolean manzu = false;
            boolean pinzu = false;
            boolean souzu = false;
            for (Group group : groups) {
                Tile first = group.getFirst();
                if (first.getRank() != rank) {
                    continue;
                }
                manzu |= first.getSuit() == Suit.MANZU;
                pinzu |= first.getSuit() == Suit.PINZU;
                souzu |= first.getSuit() == Suit.SOUZU;
            }
            if (manzu && pinzu && souzu) {
                return true;
            }
        }
        return false;
    }
}
