package com.riichimahjong.engine;

/**
 * 听牌形（由和了牌所在的组决定）
 */
public enum WaitShape {
    RYANMEN(false),           // 两面
    KANCHAN(true),            // 嵌张
    PENCHAN(true),            // 边张
    SHANPON(false),           // 双碰
    TANKI(true),              // 单骑
    KOKUSHI_SINGLE(false),    // 国士无双单面
    KOKUSHI_THIRTEEN(false);  // 国士无双十三面

    private final boolean scoresFu;

    WaitShape(boolean scoresFu) {
        this.scoresFu = scoresFu;
    }

    /**
     * 嵌张、边张、单骑计 2 符
     */
    public boolean scoresFu() {
        return scoresFu;
    }
}
