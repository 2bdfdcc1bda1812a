package com.wataruto.engine.config;

import com.wataruto.engine.core.SearchConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

/**
 * wataruto-engine 模块的自动装配入口。
 *
 * 作用：模块的开关 + 扫描器
 * - {@code wataruto.engine.enabled=false} 时整个引擎不装配；
 * - {@code @ComponentScan} 扫描 com.wataruto.engine.game 下的规则引擎和各个 AI；
 * - 默认的 {@link SearchConfig} Bean 由 {@code wataruto.search.*} 构建。
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "wataruto.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(WatarutoEngineProperties.class)
@ComponentScan(basePackages = "com.wataruto.engine.game")
public class WatarutoEngineAutoConfiguration {

    /** 调用方没有自带配置时使用的默认搜索参数 */
    @Bean
    @ConditionalOnMissingBean
    public SearchConfig defaultSearchConfig(WatarutoEngineProperties properties) {
        SearchConfig config = properties.getSearch().toConfig();
        log.info("Wataruto engine enabled: boardSize={}, timeLimit={}s, tacticalRollout={}",
                properties.getBoard().getDefaultSize(), config.getTimeLimitSeconds(), config.isTacticalRollout());
        return config;
    }
}
