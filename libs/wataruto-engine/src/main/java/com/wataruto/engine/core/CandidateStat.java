package com.wataruto.engine.core;

/**
 * 根节点的一个候选：访问数，以及落子方视角的平均收益。
 */
public record CandidateStat<C extends Command>(C move, int visits, double winRate) {
}
