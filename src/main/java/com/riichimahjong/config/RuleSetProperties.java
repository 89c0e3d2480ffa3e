package com.riichimahjong.config;

import com.riichimahjong.engine.RuleSet;
import com.riichimahjong.engine.YakumanPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 计分规则配置（application.properties 中 riichi.rules.*）
 */
@ConfigurationProperties(prefix = "riichi.rules")
public class RuleSetProperties {

    /** 多个役满同时成立时：SUM 累加倍数，MAX 只取最大 */
    private YakumanPolicy yakumanPolicy = YakumanPolicy.SUM;

    /** 13 番以上是否按累计役满 */
    private boolean kazoeYakuman = true;

    /** 是否承认双倍役满 */
    private boolean doubleYakuman = true;

    /** 30符4番 / 60符3番 是否切上满贯 */
    private boolean kiriageMangan = false;

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

    public RuleSet toRuleSet() {
        RuleSet ruleSet = new RuleSet();
        ruleSet.setYakumanPolicy(yakumanPolicy);
        ruleSet.setKazoeYakuman(kazoeYakuman);
        ruleSet.setDoubleYakuman(doubleYakuman);
        ruleSet.setKiriageMangan(kiriageMangan);
        return ruleSet;
    }
}
