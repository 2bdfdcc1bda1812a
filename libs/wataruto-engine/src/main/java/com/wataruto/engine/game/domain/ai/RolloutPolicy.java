package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;

import java.util.Random;

/**
 * 把局面模拟到结束。
 */
interface RolloutPolicy {

    /**
     * 原地向后推演 {@code state}。
     *
     * @return 胜者；和棋（达到步数上限或行棋方无子可下）返回 null
     */
    Player rollout(WatarutoState state, Random rnd);

    static RolloutPolicy of(RulesEngine engine, SearchConfig config) {
        return config.isTacticalRollout()
                ? new TacticalRolloutPolicy(engine, config.getMaxRolloutMoves(), config.getRolloutWinScanLimit())
                : new RandomRolloutPolicy(engine, config.getMaxRolloutMoves());
    }
}
