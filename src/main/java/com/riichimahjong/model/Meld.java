package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 副露（吃、碰、明杠、暗杠）。构造时校验牌型。
 */
public class Meld {
    private final MeldType type;
    private final List<Tile> tiles;   // 已排序

    public Meld(MeldType type, List<Tile> tiles) {
        if (type == null || tiles == null) {
            throw new IllegalArgumentException("副露类型和牌不能为空");
        }
        if (tiles.size() != type.getSize()) {
            throw new IllegalArgumentException(type + " 需要 " + type.getSize() + " 张牌，实际 " + tiles.size());
        }
        List<Tile> sorted = new ArrayList<>(tiles);
        Collections.sort(sorted);
        if (type == MeldType.CHI) {
            if (!isRun(sorted)) {
                throw new IllegalArgumentException("吃必须是同花色连续的三张数牌：" + sorted);
            }
        } else if (!isSameKind(sorted)) {
            throw new IllegalArgumentException(type + " 必须是同种牌：" + sorted);
        }
        this.type = type;
        this.tiles = Collections.unmodifiableList(sorted);
    }

    /**
     * 以最小的一张牌为起点创建副露（吃为顺子起点，碰/杠为该牌）
     */
    public static Meld of(MeldType type, Tile first) {
        List<Tile> tiles = new ArrayList<>();
        for (int i = 0; i < type.getSize(); i++) {
            if (type == MeldType.CHI) {
                if (!first.isNumber() || first.getRank() > 7) {
                    throw new IllegalArgumentException("无效的吃起始牌：" + first);
                }
                tiles.add(i == 0 ? first : new Tile(first.getSuit(), first.getRank() + i));
            } else {
                tiles.add(first);
            }
        }
        return new Meld(type, tiles);
    }

    private static boolean isRun(List<Tile> sorted) {
        Tile first = sorted.get(0);
        if (!first.isNumber()) {
            return false;
        }
        for (int i = 1; i < sorted.size(); i++) {
            Tile t = sorted.get(i);
            if (t.getSuit() != first.getSuit() || t.getRank() != first.getRank() + i) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSameKind(List<Tile> sorted) {
        for (Tile t : sorted) {
            if (!t.isSameAs(sorted.get(0))) {
                return false;
            }
        }
        return true;
    }

    public MeldType getType() {
        return type;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    /**
     * 最小的一张牌（种类）
     */
    public Tile getFirst() {
        return tiles.get(0).kind();
    }

    public boolean isOpen() {
        return type.isOpen();
    }

    public boolean isQuad() {
        return type == MeldType.KAN || type == MeldType.ANKAN;
    }

    @Override
    public String toString() {
        return type + tiles.toString();
    }
}
