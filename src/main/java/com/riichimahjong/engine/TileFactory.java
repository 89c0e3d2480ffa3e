package com.riichimahjong.engine;

import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 牌工厂：34 种牌、幺九牌集合、计数数组
 */
public class TileFactory {

    private TileFactory() {
    }

    /**
     * 全部 34 种牌，按种类下标排列
     */
    public static List<Tile> allKinds() {
        List<Tile> tiles = new ArrayList<>(Tile.KIND_COUNT);
        for (int index = 0; index < Tile.KIND_COUNT; index++) {
            tiles.add(Tile.fromIndex(index));
        }
        return tiles;
    }

    /**
     * 国士无双所需的 13 种幺九牌：19万 19筒 19索 东南西北白发中
     */
    public static List<Tile> terminalsAndHonors() {
        List<Tile> tiles = new ArrayList<>(13);
        for (Suit suit : new Suit[]{Suit.MANZU, Suit.PINZU, Suit.SOUZU}) {
            tiles.add(new Tile(suit, 1));
            tiles.add(new Tile(suit, 9));
        }
        for (int rank = 1; rank <= 4; rank++) {
            tiles.add(new Tile(Suit.WIND, rank));
        }
        for (int rank = 1; rank <= 3; rank++) {
            tiles.add(new Tile(Suit.DRAGON, rank));
        }
        return tiles;
    }

    /**
     * 转为按种类下标计数的数组（赤牌计入普通五）
     */
    public static int[] countKinds(Collection<Tile> tiles) {
        int[] counts = new int[Tile.KIND_COUNT];
        for (Tile tile : tiles) {
            counts[tile.getIndex()]++;
        }
        return counts;
    }
}
