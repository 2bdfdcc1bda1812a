package com.wataruto.engine.config;

import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.game.domain.ai.RandomAdvisor;
import com.wataruto.engine.game.domain.ai.TacticalMcts;
import com.wataruto.engine.game.infrastructure.json.GameJsonCodec;
import com.wataruto.engine.game.service.RulesEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class WatarutoEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WatarutoEngineAutoConfiguration.class));

    @Test
    void registersEngineAdvisorsAndCodec() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(RulesEngine.class);
            assertThat(context).hasSingleBean(TacticalMcts.class);
            assertThat(context).hasSingleBean(RandomAdvisor.class);
            assertThat(context).hasSingleBean(GameJsonCodec.class);
            assertThat(context.getBean(SearchConfig.class).getTimeLimitSeconds()).isEqualTo(10.0);
            assertThat(context.getBean(RulesEngine.class).newGame().size()).isEqualTo(18);
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "wataruto.board.default-size=9",
                        "wataruto.search.time-limit-seconds=2.5",
                        "wataruto.search.max-simulations=500",
                        "wataruto.search.tactical-rollout=false",
                        "wataruto.search.seed=99")
                .run(context -> {
                    SearchConfig config = context.getBean(SearchConfig.class);
                    assertThat(config.getTimeLimitSeconds()).isEqualTo(2.5);
                    assertThat(config.getMaxSimulations()).isEqualTo(500);
                    assertThat(config.isTacticalRollout()).isFalse();
                    assertThat(config.getSeed()).isEqualTo(99L);
                    assertThat(config.getWinScanLimit()).isEqualTo(30);
                    assertThat(context.getBean(RulesEngine.class).newGame().size()).isEqualTo(9);
                });
    }

    @Test
    void userSearchConfigWins() {
        contextRunner
                .withBean(SearchConfig.class, () -> SearchConfig.builder().timeLimitSeconds(1).build())
                .run(context -> assertThat(context.getBean(SearchConfig.class).getTimeLimitSeconds()).isEqualTo(1.0));
    }

    @Test
    void switchedOff() {
        contextRunner
                .withPropertyValues("wataruto.engine.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(RulesEngine.class);
                    assertThat(context).doesNotHaveBean(TacticalMcts.class);
                    assertThat(context).doesNotHaveBean(SearchConfig.class);
                });
    }

    @Test
    void searchDefaultsMatchTheConfigDefaults() {
        SearchConfig fromProperties = new WatarutoEngineProperties().getSearch().toConfig();

        assertThat(fromProperties).isEqualTo(SearchConfig.defaults());
    }
}
