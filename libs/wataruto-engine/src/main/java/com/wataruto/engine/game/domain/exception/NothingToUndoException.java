package com.wataruto.engine.game.domain.exception;

/** 历史为空时请求悔棋 */
public class NothingToUndoException extends IllegalStateException {

    public NothingToUndoException(String message) {
        super(message);
    }
}
