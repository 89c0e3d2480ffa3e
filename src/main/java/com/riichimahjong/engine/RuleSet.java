package com.riichimahjong.engine;

/**
 * 计分规则选项
 */
public class RuleSet {
    private YakumanPolicy yakumanPolicy = YakumanPolicy.SUM;
    private boolean kazoeYakuman = true;    // 13 番以上按累计役满
    private boolean doubleYakuman = true;   // 国士十三面、四暗刻单骑、纯正九莲、大四喜按双倍役满
    private boolean kiriageMangan = false;  // 30符4番 / 60符3番 切上满贯

    public static RuleSet defaults() {
        return new RuleSet();
    }

    public YakumanPolicy getYakumanPolicy() {
        return yakumanPolicy;
    }

    public void setYakumanPolicy(YakumanPolicy yakumanPolicy) {
        this.yakumanPolicy = yakumanPolicy;
    }

    public boolean isKazoeYakuman() {
        return kazoeYakuman;
    }

    public void setKazoeYakuman(boolean kazoeYakuman) {
        this.kazoeYakuman = kazoeYakuman;
    }

    public boolean isDoubleYakuman() {
        return doubleYakuman;
    }

    public void setDoubleYakuman(boolean doubleYakuman) {
        this.doubleYakuman = doubleYakuman;
    }

    public boolean isKiriageMangan() {
        return kiriageMangan;
    }

    public void setKiriageMangan(boolean kiriageMangan) {
        this.kiriageMangan = kiriageMangan;
    }

    @Override
    public String toString() {
        return "RuleSet{yakumanPolicy=" + yakumanPolicy + ", kazoeYakuman=" + kazoeYakuman
                + ", doubleYakuman=" + doubleYakuman + ", kiriageMangan=" + kiriageMangan + "}";
    }
}
