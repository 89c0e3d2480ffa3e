package com.riichimahjong.engine;

import java.util.function.Predicate;

/**
 * 一条役的判定规则：役 + 判定条件
 */
public final class YakuRule {
    private final Yaku yaku;
    private final Predicate<HandView> condition;

    public YakuRule(Yaku yaku, Predicate<HandView> condition) {
        this.yaku = yaku;
        this.condition = condition;
    }

    public Yaku getYaku() {
        return yaku;
    }

    /**
     * 条件成立且该役在当前门前/副露状态下有番数
     */
    public boolean matches(HandView view) {
        return yaku.getHan(view.isClosed()) > 0 && condition.test(view);
    }

    @Override
    public String toString() {
        return "YakuRule{" + yaku + "}";
    }
}
