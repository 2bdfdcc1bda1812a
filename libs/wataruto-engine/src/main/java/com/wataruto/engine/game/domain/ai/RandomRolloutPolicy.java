package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;

import java.util.List;
import java.util.Random;

/**
 * 纯随机模拟，最多 {@code maxMoves} 步。
 */
class RandomRolloutPolicy implements RolloutPolicy {

    protected final RulesEngine engine;
    private final int maxMoves;

    RandomRolloutPolicy(RulesEngine engine, int maxMoves) {
        this.engine = engine;
        this.maxMoves = maxMoves;
    }

    @Override
    public Player rollout(WatarutoState state, Random rnd) {
        for (int ply = 0; ply < maxMoves; ply++) {
            if (state.isOver()) return state.getWinner();
            List<Move> moves = engine.legalMoves(state);
            if (moves.isEmpty()) return null;
            engine.applyMove(state, choose(state, moves, rnd));
        }
        // 上限前的最后一步也可能已经连通
        return state.getWinner();
    }

    /** 从非空的合法着法中挑一步 */
    protected Move choose(WatarutoState state, List<Move> moves, Random rnd) {
        return moves.get(rnd.nextInt(moves.size()));
    }
}
