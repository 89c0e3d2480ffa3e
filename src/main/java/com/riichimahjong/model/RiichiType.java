package com.riichimahjong.model;

/**
 * 立直状态
 */
public enum RiichiType {
    NONE,           // 未立直
    RIICHI,         // 立直
    DOUBLE_RIICHI;  // 两立直（第一巡立直）

    public boolean isDeclared() {
        return this != NONE;
    }
}
