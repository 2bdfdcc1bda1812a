package com.wataruto.engine.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次搜索的参数。
 *
 * 各扫描上限是精度与速度的折中，取值凭经验，属于配置而不是规则。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchConfig {

    /** 墙钟时间预算（秒）；0 表示根节点检查后即停。不限时（如无穷大）须配合 maxSimulations。 */
    @Builder.Default
    private double timeLimitSeconds = 10.0;

    /** 模拟次数上限，可选；null 表示只受时间限制 */
    private Integer maxSimulations;

    /** UCB1 探索常数 C */
    @Builder.Default
    private double explorationWeight = Math.sqrt(2);

    /** 模拟时抽样着法里有一步制胜就直接下 */
    @Builder.Default
    private boolean tacticalRollout = true;

    /** 搜索前根节点检查一步制胜的着法数 */
    @Builder.Default
    private int winScanLimit = 30;

    /** 根节点检查对方一步制胜威胁的着法数 */
    @Builder.Default
    private int threatScanLimit = 10;

    /** 战术模式下模拟每步抽样找制胜的着法数 */
    @Builder.Default
    private int rolloutWinScanLimit = 30;

    /** 模拟步数上限，达到即记和棋 */
    @Builder.Default
    private int maxRolloutMoves = 100;

    /** 结果中候选排行的条数 */
    @Builder.Default
    private int topCandidates = 5;

    /** 随机种子，便于复现；null 则每次新取 */
    private Long seed;

    /** 候选表用 INFO 而不是 DEBUG 打印 */
    @Builder.Default
    private boolean verbose = false;

    public static SearchConfig defaults() {
        return SearchConfig.builder().build();
    }
}
