package com.riichimahjong.engine;

/**
 * 计分失败的原因
 */
public enum ScoringError {
    INVALID_HAND_SHAPE("手牌无法拆解为任何和牌形"),
    NO_YAKU_FOUND("No Yaku Found：没有任何役"),
    AMBIGUOUS_CONFIGURATION("场况标记互相矛盾");

    private final String defaultMessage;

    ScoringError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
