package com.riichimahjong.engine;

/**
 * 拆解后的组类型
 */
public enum GroupType {
    RUN,      // 顺子
    TRIPLET,  // 刻子
    QUAD,     // 杠子
    PAIR      // 对子（雀头）
}
