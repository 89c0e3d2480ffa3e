package com.riichimahjong.engine;

/**
 * 满贯以上的封顶档位及其基本点
 */
public enum HandLimit {
    MANGAN("满贯", 2000),
    HANEMAN("跳满", 3000),
    BAIMAN("倍满", 4000),
    SANBAIMAN("三倍满", 6000),
    KAZOE_YAKUMAN("累计役满", 8000),
    YAKUMAN("役满", 8000);

    private final String displayName;
    private final int basePoints;

    HandLimit(String displayName, int basePoints) {
        this.displayName = displayName;
        this.basePoints = basePoints;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getBasePoints() {
        return basePoints;
    }
}
