package com.wataruto.engine.core;

/**
 * AI 顾问抽象：给定状态，为行棋方给出一个 Command。
 * - config 携带时间预算和搜索参数，用不到的可以忽略；
 * - 泛型 S、C 让顾问不绑定具体游戏。
 * 树搜索、随机走子、远程模型都可以实现该接口。
 */
public interface AiAdvisor<S extends GameState, C extends Command> {

    /**
     * 搜索给定状态，返回选中的着法及统计信息。
     * 不修改传入的状态。
     */
    SearchResult<C> search(S state, SearchConfig config);

    /** 只要着法时的便捷方法 */
    default C suggest(S state, SearchConfig config) {
        return search(state, config).getMove();
    }
}
