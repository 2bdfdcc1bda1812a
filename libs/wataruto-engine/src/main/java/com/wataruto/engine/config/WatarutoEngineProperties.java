package com.wataruto.engine.config;

import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.game.domain.model.Board;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 引擎配置，前缀 {@code wataruto}。
 *
 * 每一项都有默认值，不写任何配置也能用；
 * 可由 application.yml 或环境变量覆盖，例如
 * {@code wataruto.search.time-limit-seconds=5}.
 */
@Data
@ConfigurationProperties(prefix = "wataruto")
public class WatarutoEngineProperties {

    private BoardProperties board = new BoardProperties();

    private SearchProperties search = new SearchProperties();

    @Data
    public static class BoardProperties {
        /** 调用方未指定时新棋盘的边长 */
        private int defaultSize = Board.DEFAULT_SIZE;
    }

    /** {@link SearchConfig} 的默认值，各参数含义见该类 */
    @Data
    public static class SearchProperties {
        private double timeLimitSeconds = 10.0;
        private Integer maxSimulations;
        private double explorationWeight = Math.sqrt(2);
        private boolean tacticalRollout = true;
        private int winScanLimit = 30;
        private int threatScanLimit = 10;
        private int rolloutWinScanLimit = 30;
        private int maxRolloutMoves = 100;
        private int topCandidates = 5;
        private Long seed;
        private boolean verbose = false;

        public SearchConfig toConfig() {
            return SearchConfig.builder()
                    .timeLimitSeconds(timeLimitSeconds)
                    .maxSimulations(maxSimulations)
                    .explorationWeight(explorationWeight)
                    .tacticalRollout(tacticalRollout)
                    .winScanLimit(winScanLimit)
                    .threatScanLimit(threatScanLimit)
                    .rolloutWinScanLimit(rolloutWinScanLimit)
                    .maxRolloutMoves(maxRolloutMoves)
                    .topCandidates(topCandidates)
                    .seed(seed)
                    .verbose(verbose)
                    .build();
        }
    }
}
