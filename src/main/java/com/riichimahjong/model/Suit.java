package com.riichimahjong.model;

/**
 * 牌的花色
 */
public enum Suit {
    MANZU('m'),   // 万子（1-9）
    PINZU('p'),   // 筒子（1-9）
    SOUZU('s'),   // 索子（1-9）
    WIND('z'),    // 风牌（1=东 2=南 3=西 4=北）
    DRAGON('z');  // 三元牌（1=白 2=发 3=中）

    private final char code;

    Suit(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * 是否为数牌（可以组成顺子）
     */
    public boolean isNumber() {
        return this == MANZU || this == PINZU || this == SOUZU;
    }

    public boolean isHonor() {
        return this == WIND || this == DRAGON;
    }
}
