package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 和牌时的手牌：门内的牌（含和了牌）+ 副露 + 和了牌。
 * <p>
 * 杠子只占一个面子位置，所以约束是：门内张数 + 3 × 副露数 = 14。
 * 该约束由拆解器检查，这里只保存数据。
 */
public class Hand {
    private final List<Tile> concealedTiles;
    private final List<Meld> melds;
    private final Tile winningTile;

    public Hand(List<Tile> concealedTiles, List<Meld> melds, Tile winningTile) {
        if (concealedTiles == null || winningTile == null) {
            throw new IllegalArgumentException("手牌和和了牌不能为空");
        }
        List<Tile> sorted = new ArrayList<>(concealedTiles);
        Collections.sort(sorted);
        this.concealedTiles = Collections.unmodifiableList(sorted);
        this.melds = melds == null
                ? Collections.<Meld>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(melds));
        this.winningTile = winningTile;
    }

    public Hand(List<Tile> concealedTiles, Tile winningTile) {
        this(concealedTiles, null, winningTile);
    }

    public List<Tile> getConcealedTiles() {
        return concealedTiles;
    }

    public List<Meld> getMelds() {
        return melds;
    }

    public Tile getWinningTile() {
        return winningTile;
    }

    /**
     * 门前清：没有明副露（暗杠不破坏门清）
     */
    public boolean isConcealed() {
        for (Meld meld : melds) {
            if (meld.isOpen()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 手中全部的牌（门内 + 副露，杠子计 4 张）
     */
    public List<Tile> getAllTiles() {
        List<Tile> all = new ArrayList<>(concealedTiles);
        for (Meld meld : melds) {
            all.addAll(meld.getTiles());
        }
        return all;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Tile tile : concealedTiles) {
            sb.append(tile.getCode());
        }
        for (Meld meld : melds) {
            sb.append(' ').append(meld);
        }
        sb.append(" 和了牌=").append(winningTile.getCode());
        return sb.toString();
    }
}
