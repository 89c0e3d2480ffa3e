package com.riichimahjong.engine;

/**
 * 同一拆解下多个役满同时成立时的合计方式
 */
public enum YakumanPolicy {
    SUM,  // 倍数相加（如 四暗刻 + 字一色 = 双倍役满）
    MAX   // 只取最大的一个
}
