package com.wataruto.engine.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 搜索结果：选中的着法及其背后的统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult<C extends Command> {

    /** 着法的产生方式 */
    public enum Reason {
        /** 根节点扫描找到一步制胜 */
        IMMEDIATE_WIN,
        /** 树搜索后访问数最多的根子节点 */
        TREE_SEARCH,
        /** 没有完成任何模拟；用堵棋应对对方威胁 */
        BLOCK_FALLBACK,
        /** 均匀随机的合法着法：没有完成模拟，或该顾问不搜索 */
        RANDOM
    }

    private C move;

    private Reason reason;

    private int simulations;

    private int nodesCreated;

    private double elapsedSeconds;

    /** 按访问数排序，最好的在前 */
    @Builder.Default
    private List<CandidateStat<C>> topCandidates = new ArrayList<>();
}
