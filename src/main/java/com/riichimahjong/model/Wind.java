package com.riichimahjong.model;

/**
 * 风位（自风 / 场风）
 */
public enum Wind {
    EAST(1, "东"),
    SOUTH(2, "南"),
    WEST(3, "西"),
    NORTH(4, "北");

    private final int rank;
    private final String displayName;

    Wind(int rank, String displayName) {
        this.rank = rank;
        this.displayName = displayName;
    }

    public int getRank() {
        return rank;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 对应的风牌
     */
    public Tile toTile() {
        return new Tile(Suit.WIND, rank);
    }

    public static Wind ofRank(int rank) {
        for (Wind wind : values()) {
            if (wind.rank == rank) {
                return wind;
            }
        }
        throw new IllegalArgumentException("无效的风牌编号：" + rank);
    }
}
