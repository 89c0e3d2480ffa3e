package com.riichimahjong.model;

/**
 * 和牌方式
 */
public enum WinMethod {
    RON,    // 荣和（他家打出）
    TSUMO   // 自摸
}
