package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 见胜就收的随机模拟：每步最多抽 {@code winScanLimit} 个合法着法，
 * 有能连通的就下第一个，否则随机下一步。
 */
class TacticalRolloutPolicy extends RandomRolloutPolicy {

    private final int winScanLimit;

    TacticalRolloutPolicy(RulesEngine engine, int maxMoves, int winScanLimit) {
        super(engine, maxMoves);
        this.winScanLimit = winScanLimit;
    }

    @Override
    protected Move choose(WatarutoState state, List<Move> moves, Random rnd) {
        if (winScanLimit > 0) {
            List<Move> sample = sample(moves, winScanLimit, rnd);
            Move win = engine.winningMove(state, sample).orElse(null);
            if (win != null) return win;
        }
        return super.choose(state, moves, rnd);
    }

    /** 部分 Fisher-Yates：洗牌拷贝的前 k 个 */
    static List<Move> sample(List<Move> moves, int k, Random rnd) {
        if (moves.size() <= k) return moves;
        List<Move> pool = new ArrayList<>(moves);
        for (int i = 0; i < k; i++) {
            Collections.swap(pool, i, i + rnd.nextInt(pool.size() - i));
        }
        return pool.subList(0, k);
    }
}
