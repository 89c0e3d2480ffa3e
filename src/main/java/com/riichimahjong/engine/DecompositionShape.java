package com.riichimahjong.engine;

/**
 * 和牌形
 */
public enum DecompositionShape {
    STANDARD,          // 四面子一雀头
    SEVEN_PAIRS,       // 七对子
    THIRTEEN_ORPHANS   // 国士无双
}
