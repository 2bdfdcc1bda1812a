package com.wataruto.engine.game.domain.exception;

/**
 * 落子被拒：非己方回合、形状非法、格子被占或长条用尽。
 * 状态保持原样。传输层按 IllegalArgumentException 处理（400）。
 */
public class IllegalMoveException extends IllegalArgumentException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
