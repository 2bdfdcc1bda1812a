package com.wataruto.engine.game.domain.model;

/**
 * 对局双方。
 * A 连通上下（第 0 行到第 N-1 行），B 连通左右（第 0 列到第 N-1 列）。
 */
public enum Player {

    /** 先手，连通上下两边 */
    A,
    /** 连通左右两边 */
    B;

    public Player opponent() {
        return this == A ? B : A;
    }
}
