package com.riichimahjong.config;

import com.riichimahjong.engine.RuleSet;
import com.riichimahjong.engine.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 计分引擎装配：引擎本身不依赖 Spring，这里按配置创建一个共享实例
 */
@Configuration
@EnableConfigurationProperties(RuleSetProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ScoringEngine scoringEngine(RuleSetProperties properties) {
        RuleSet ruleSet = properties.toRuleSet();
        log.info("计分规则：役满合计={}, 累计役满={}, 双倍役满={}, 切上满贯={}",
                ruleSet.getYakumanPolicy(), ruleSet.isKazoeYakuman(),
                ruleSet.isDoubleYakuman(), ruleSet.isKiriageMangan());
        return new ScoringEngine(ruleSet);
    }
}
