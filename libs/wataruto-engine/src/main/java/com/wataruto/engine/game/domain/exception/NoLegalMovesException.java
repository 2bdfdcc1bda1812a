package com.wataruto.engine.game.domain.exception;

/**
 * 行棋方没有合法着法时仍调用了搜索。
 * 引擎不判无子可下的胜负，由调用方决定怎么处理。
 */
public class NoLegalMovesException extends IllegalStateException {

    public NoLegalMovesException(String message) {
        super(message);
    }
}
