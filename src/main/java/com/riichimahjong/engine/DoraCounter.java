package com.riichimahjong.engine;

import com.riichimahjong.model.Tile;

import java.util.List;

/**
 * 宝牌计数
 */
public final class DoraCounter {

    private DoraCounter() {
    }

    /**
     * 每个指示牌所指的宝牌，手中每有一张计 1 番（同一指示牌出现两次则计两次）
     */
    public static int countDora(List<Tile> tiles, List<Tile> indicators) {
        int count = 0;
        for (Tile indicator : indicators) {
            Tile dora = indicator.doraSuccessor();
            for (Tile tile : tiles) {
                if (tile.isSameAs(dora)) {
                    count++;
                }
            }
        }
        return count;
    }

    public static int countRed(List<Tile> tiles) {
        int count = 0;
        for (Tile tile : tiles) {
            if (tile.isRed()) {
                count++;
            }
        }
        return count;
    }
}
