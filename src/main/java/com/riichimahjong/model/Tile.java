package com.riichimahjong.model;

import java.util.Objects;

/**
 * 麻将牌（不可变）。
 * <p>
 * 同一种牌有 34 种（kind）：万/筒/索各 9 种、风牌 4 种、三元牌 3 种。
 * 赤五（赤宝牌）只是牌的一个标记，不改变它的种类。
 */
public final class Tile implements Comparable<Tile> {

    public static final int KIND_COUNT = 34;

    private static final String[] NUMBER_NAMES = {"", "万", "筒", "索"};
    private static final String[] DRAGON_NAMES = {"", "白", "发", "中"};

    private final Suit suit;      // 花色
    private final int rank;       // 牌值（数牌 1-9，风 1-4，三元 1-3）
    private final boolean red;    // 是否赤五

    public Tile(Suit suit, int rank) {
        this(suit, rank, false);
    }

    public Tile(Suit suit, int rank, boolean red) {
        if (suit == null) {
            throw new IllegalArgumentException("花色不能为空");
        }
        int maxRank = suit.isNumber() ? 9 : (suit == Suit.WIND ? 4 : 3);
        if (rank < 1 || rank > maxRank) {
            throw new IllegalArgumentException("无效的牌值：" + suit + " " + rank);
        }
        if (red && !(suit.isNumber() && rank == 5)) {
            throw new IllegalArgumentException("只有数牌的五可以是赤牌");
        }
        this.suit = suit;
        this.rank = rank;
        this.red = red;
    }

    /**
     * 根据种类下标（0-33）创建牌
     */
    public static Tile fromIndex(int index) {
        if (index < 0 || index >= KIND_COUNT) {
            throw new IllegalArgumentException("无效的牌种类下标：" + index);
        }
        if (index < 9) {
            return new Tile(Suit.MANZU, index + 1);
        }
        if (index < 18) {
            return new Tile(Suit.PINZU, index - 8);
        }
        if (index < 27) {
            return new Tile(Suit.SOUZU, index - 17);
        }
        if (index < 31) {
            return new Tile(Suit.WIND, index - 26);
        }
        return new Tile(Suit.DRAGON, index - 30);
    }

    public Suit getSuit() {
        return suit;
    }

    public int getRank() {
        return rank;
    }

    public boolean isRed() {
        return red;
    }

    /**
     * 种类下标：万 0-8，筒 9-17，索 18-26，东南西北 27-30，白发中 31-33
     */
    public int getIndex() {
        switch (suit) {
            case MANZU:
                return rank - 1;
            case PINZU:
                return 8 + rank;
            case SOUZU:
                return 17 + rank;
            case WIND:
                return 26 + rank;
            case DRAGON:
                return 30 + rank;
            default:
                throw new IllegalStateException("未知花色：" + suit);
        }
    }

    /**
     * 去掉赤牌标记后的同种牌
     */
    public Tile kind() {
        return red ? new Tile(suit, rank) : this;
    }

    public boolean isNumber() {
        return suit.isNumber();
    }

    public boolean isHonor() {
        return suit.isHonor();
    }

    public boolean isWind() {
        return suit == Suit.WIND;
    }

    public boolean isDragon() {
        return suit == Suit.DRAGON;
    }

    /**
     * 老头牌（数牌的 1、9）
     */
    public boolean isTerminal() {
        return suit.isNumber() && (rank == 1 || rank == 9);
    }

    /**
     * 幺九牌：老头牌或字牌
     */
    public boolean isTerminalOrHonor() {
        return isTerminal() || isHonor();
    }

    /**
     * 中张牌（数牌 2-8）
     */
    public boolean isSimple() {
        return suit.isNumber() && rank >= 2 && rank <= 8;
    }

    /**
     * 绿一色用牌：23468索 和 发
     */
    public boolean isGreen() {
        if (suit == Suit.SOUZU) {
            return rank == 2 || rank == 3 || rank == 4 || rank == 6 || rank == 8;
        }
        return suit == Suit.DRAGON && rank == 2;
    }

    /**
     * 宝牌指示牌所指的下一张牌：数牌 9 接 1，北接东，中接白
     */
    public Tile doraSuccessor() {
        if (suit.isNumber()) {
            return new Tile(suit, rank == 9 ? 1 : rank + 1);
        }
        if (suit == Suit.WIND) {
            return new Tile(suit, rank == 4 ? 1 : rank + 1);
        }
        return new Tile(suit, rank == 3 ? 1 : rank + 1);
    }

    /**
     * 判断两张牌是否同种（不考虑赤牌标记）
     */
    public boolean isSameAs(Tile other) {
        return other != null && this.suit == other.suit && this.rank == other.rank;
    }

    /**
     * 牌码：1m-9m、1p-9p、1s-9s、赤五为 0m/0p/0s，字牌 1z-7z（东南西北白发中）
     */
    public String getCode() {
        if (suit.isNumber()) {
            return (red ? "0" : String.valueOf(rank)) + suit.getCode();
        }
        int honorRank = suit == Suit.WIND ? rank : rank + 4;
        return honorRank + "z";
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        switch (suit) {
            case MANZU:
                return (red ? "赤" : "") + rank + NUMBER_NAMES[1];
            case PINZU:
                return (red ? "赤" : "") + rank + NUMBER_NAMES[2];
            case SOUZU:
                return (red ? "赤" : "") + rank + NUMBER_NAMES[3];
            case WIND:
                return Wind.ofRank(rank).getDisplayName();
            case DRAGON:
                return DRAGON_NAMES[rank];
            default:
                return "未知";
        }
    }

    /**
     * 排序：先按花色，再按数值，赤牌排在普通五之后
     */
    @Override
    public int compareTo(Tile other) {
        if (this.suit != other.suit) {
            return this.suit.ordinal() - other.suit.ordinal();
        }
        if (this.rank != other.rank) {
            return this.rank - other.rank;
        }
        return Boolean.compare(this.red, other.red);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile tile = (Tile) o;
        return rank == tile.rank && red == tile.red && suit == tile.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(suit, rank, red);
    }

    @Override
    public String toString() {
        return getCode();
    }
}
