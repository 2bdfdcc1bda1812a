package com.wataruto.engine.core;

/**
 * 一局进行中对局的状态。
 * - 必须可拷贝：重放、AI 搜索、回滚都在拷贝上进行；
 * - 具体游戏（如 WatarutoState）实现该接口；
 * - 搜索时拷贝真实对局并在拷贝上试下，拷贝不能与原对象共享任何可变结构。
 */
public interface GameState {

    /**
     * 返回独立的深拷贝。
     */
    GameState copy();
}
