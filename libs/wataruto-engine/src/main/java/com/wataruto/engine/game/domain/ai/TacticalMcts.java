package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.core.AiAdvisor;
import com.wataruto.engine.core.CandidateStat;
import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.core.SearchResult;
import com.wataruto.engine.game.domain.constants.GameMessages;
import com.wataruto.engine.game.domain.exception.NoLegalMovesException;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.Position;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * 战术 MCTS：
 * 1) 先找必胜（根节点一步连通的着法直接下，不再搜索）
 * 2) 再找必堵（对方下一手能连通时，能堵住全部连通的着法最先展开）
 * 3) UCT 搜索，直到时间预算或模拟次数上限用完
 * 4) 选访问数最多的根子节点
 * <p>
 * 只依赖 {@link RulesEngine} 接口；每个节点持有自己的状态拷贝，调用方的状态不会被改动。
 * 单次搜索单线程、调用之间不保留状态，同一实例可供多个调用方并发使用。
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class TacticalMcts implements AiAdvisor<WatarutoState, Move> {

    private final RulesEngine engine;

    @Override
    public SearchResult<Move> search(WatarutoState state, SearchConfig config) {
        Objects.requireNonNull(state, "state must not be null");
        SearchConfig cfg = config != null ? config : SearchConfig.defaults();
        long started = System.nanoTime();

        Player me = state.getCurrent();
        List<Move> rootMoves = engine.legalMoves(state);
        if (rootMoves.isEmpty()) {
            throw new NoLegalMovesException(GameMessages.formatNoLegalMoves(me));
        }
        Random rnd = cfg.getSeed() != null ? new Random(cfg.getSeed()) : new Random();

        // 1) 自己这一手就能连通
        List<Move> wins = engine.immediateWins(state, me, cfg.getWinScanLimit());
        if (!wins.isEmpty()) {
            Move win = wins.get(0);
            log.debug("Player {} wins at once with {}", me, win);
            return SearchResult.<Move>builder()
                    .move(win)
                    .reason(SearchResult.Reason.IMMEDIATE_WIN)
                    .elapsedSeconds(secondsSince(started))
                    .topCandidates(new ArrayList<>(List.of(new CandidateStat<>(win, 1, 1.0))))
                    .build();
        }

        // 2) 不堵的话对方下一手连通
        List<Move> blocks = List.of();
        List<Move> threats = engine.immediateWins(state, me.opponent(), cfg.getThreatScanLimit());
        if (!threats.isEmpty()) {
            blocks = findBlocks(state, rootMoves, threats, cfg.getThreatScanLimit());
            log.debug("Player {} threatens {} bridge(s); {} blocking move(s)", me.opponent(), threats.size(), blocks.size());
        }

        // 3) 树搜索
        SearchNode root = SearchNode.root(engine.copy(state), rootMoves);
        root.prioritize(blocks);
        RolloutPolicy policy = RolloutPolicy.of(engine, cfg);
        long budget = budgetNanos(cfg.getTimeLimitSeconds());
        Integer maxSimulations = cfg.getMaxSimulations();

        int simulations = 0;
        int nodes = 1;
        while (System.nanoTime() - started < budget
                && (maxSimulations == null || simulations < maxSimulations)) {
            // 选择：已完全展开就继续往下
            SearchNode node = root;
            while (!node.isTerminal() && !node.hasUntried()) {
                node = node.selectChild(cfg.getExplorationWeight());
            }
            // 扩展
            if (!node.isTerminal()) {
                node = node.expand(engine, rnd);
                nodes++;
            }
            // 模拟
            Player winner = node.state().isOver()
                    ? node.state().getWinner()
                    : policy.rollout(engine.copy(node.state()), rnd);
            // 回传
            for (SearchNode n = node; n != null; n = n.parent()) {
                n.update(winner);
            }
            simulations++;
        }

        // 4) 选子
        SearchResult<Move> result;
        SearchNode best = root.mostVisitedChild();
        if (best != null) {
            result = SearchResult.<Move>builder()
                    .move(best.move())
                    .reason(SearchResult.Reason.TREE_SEARCH)
                    .simulations(simulations)
                    .nodesCreated(nodes)
                    .topCandidates(rank(root, cfg.getTopCandidates()))
                    .build();
        } else if (!blocks.isEmpty()) {
            result = SearchResult.<Move>builder()
                    .move(blocks.get(0))
                    .reason(SearchResult.Reason.BLOCK_FALLBACK)
                    .nodesCreated(nodes)
                    .build();
        } else {
            result = SearchResult.<Move>builder()
                    .move(rootMoves.get(rnd.nextInt(rootMoves.size())))
                    .reason(SearchResult.Reason.RANDOM)
                    .nodesCreated(nodes)
                    .build();
        }
        result.setElapsedSeconds(secondsSince(started));
        report(me, result, cfg.isVerbose());
        return result;
    }

    /**
     * 落子方的应手中，下完后对方已无一步制胜的那些。
     * 对方能否连通只取决于对方自己的棋子，应手只能靠占掉对方连通路径上的格子来堵；
     * 没碰到某个威胁任何一格的应手先过滤掉，再逐个复核。
     */
    private List<Move> findBlocks(WatarutoState state, List<Move> myMoves, List<Move> threats, int limit) {
        List<Set<Long>> threatCells = new ArrayList<>(threats.size());
        for (Move t : threats) {
            threatCells.add(cellsOf(t));
        }

        List<Move> blocks = new ArrayList<>();
        for (Move m : myMoves) {
            Set<Long> mine = cellsOf(m);
            boolean touchesAll = true;
            for (Set<Long> cells : threatCells) {
                if (Collections.disjoint(mine, cells)) {
                    touchesAll = false;
                    break;
                }
            }
            if (!touchesAll) continue;

            WatarutoState trial = engine.copy(state);
            engine.applyMove(trial, m);
            if (trial.isOver() || engine.immediateWins(trial, m.player().opponent(), limit).isEmpty()) {
                blocks.add(m);
            }
        }
        return blocks;
    }

    private static Set<Long> cellsOf(Move move) {
        Set<Long> cells = new HashSet<>();
        for (Position p : move.path()) {
            cells.add(((long) p.row() << 32) | (p.col() & 0xffffffffL));
        }
        return cells;
    }

    private static List<CandidateStat<Move>> rank(SearchNode root, int top) {
        List<SearchNode> children = new ArrayList<>(root.children());
        children.sort(Comparator.comparingInt(SearchNode::visits).reversed());
        List<CandidateStat<Move>> stats = new ArrayList<>();
        for (int i = 0; i < Math.min(top, children.size()); i++) {
            SearchNode c = children.get(i);
            stats.add(new CandidateStat<>(c.move(), c.visits(), c.winRate()));
        }
        return stats;
    }

    private static void report(Player me, SearchResult<Move> result, boolean verbose) {
        if (verbose) {
            log.info("Player {} plays {} ({}): {} simulations, {} nodes, {}s", me, result.getMove(),
                    result.getReason(), result.getSimulations(), result.getNodesCreated(),
                    String.format("%.2f", result.getElapsedSeconds()));
            for (CandidateStat<Move> c : result.getTopCandidates()) {
                log.info("  {} visits={} winRate={}", c.move(), c.visits(), String.format("%.3f", c.winRate()));
            }
        } else {
            log.debug("Player {} plays {} ({}): {} simulations, {} nodes", me, result.getMove(),
                    result.getReason(), result.getSimulations(), result.getNodesCreated());
        }
    }

    /**
     * 秒 -> 纳秒预算。负数、NaN 记为 0；过大或无穷大饱和到 Long.MAX_VALUE，即不限时。
     * 与已用时间 {@code nanoTime() - started} 比较，不会因加法溢出而提前结束。
     */
    static long budgetNanos(double seconds) {
        if (!(seconds > 0)) return 0L;
        double nanos = seconds * 1_000_000_000.0;
        return nanos >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) nanos;
    }

    private static double secondsSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
