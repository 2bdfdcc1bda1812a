package com.wataruto.engine.game.domain.rule;

import com.wataruto.engine.game.domain.model.Player;

/** 局面结果：进行中 / A 连通 / B 连通 / 行棋方无子可下 */
public enum Outcome {
    /** 对局进行中 */
    ONGOING,
    /** A 连通上下 */
    A_WINS,
    /** B 连通左右 */
    B_WINS,
    /**
     * 行棋方没有合法着法，且双方都未连通。
     * 只报告，引擎不因此结束对局。
     */
    STALEMATE;

    public static Outcome winOf(Player player) {
        return player == Player.A ? A_WINS : B_WINS;
    }
}
