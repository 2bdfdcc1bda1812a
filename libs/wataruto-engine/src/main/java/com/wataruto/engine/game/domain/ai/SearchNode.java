package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * 搜索树节点。
 * <p>
 * 子节点自上而下持有；{@code parent} 只是回指，用于模拟结束后回传统计。
 * 每个节点持有自己的一份状态拷贝。
 * {@code actor} 是走到这个节点的那一方，{@code score / visits} 即该方的平均收益，
 * 父节点按它取最大。
 */
final class SearchNode {

    private final WatarutoState state;
    private final SearchNode parent;
    private final Move move;
    private final Player actor;

    private final List<Move> untried;
    /** 优先展开的未尝试着法，先于随机挑选 */
    private final Deque<Move> priority = new ArrayDeque<>();
    private final List<SearchNode> children = new ArrayList<>();

    private int visits;
    private double score;

    SearchNode(WatarutoState state, SearchNode parent, Move move, Player actor, List<Move> untried) {
        this.state = state;
        this.parent = parent;
        this.move = move;
        this.actor = actor;
        this.untried = untried;
    }

    /** 搜索根：没人走到这里，actor 记为行棋方的对手 */
    static SearchNode root(WatarutoState state, List<Move> legalMoves) {
        return new SearchNode(state, null, null, state.getCurrent().opponent(), new ArrayList<>(legalMoves));
    }

    /** 此处已终局，或已无着可下 */
    boolean isTerminal() {
        return state.isOver() || (untried.isEmpty() && children.isEmpty());
    }

    boolean hasUntried() {
        return !untried.isEmpty();
    }

    void prioritize(List<Move> moves) {
        priority.addAll(moves);
    }

    /**
     * UCB1 = 平均收益 + c * sqrt(ln(父访问数) / 访问数)；未访问的子节点优先。
     */
    double ucb1(double explorationWeight) {
        if (visits == 0) return Double.POSITIVE_INFINITY;
        double exploitation = score / visits;
        double exploration = explorationWeight * Math.sqrt(Math.log(parent.visits) / visits);
        return exploitation + exploration;
    }

    SearchNode selectChild(double explorationWeight) {
        SearchNode best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (SearchNode child : children) {
            double s = child.ucb1(explorationWeight);
            if (best == null || s > bestScore) {
                best = child;
                bestScore = s;
            }
        }
        return best;
    }

    /**
     * 取一个未尝试的着法（优先着法在前，否则均匀随机），在新拷贝上落子，
     * 并把新子节点挂到当前节点下。
     */
    SearchNode expand(RulesEngine engine, Random rnd) {
        if (untried.isEmpty()) {
            throw new IllegalStateException("no untried moves to expand");
        }
        Move next = null;
        while (!priority.isEmpty() && next == null) {
            Move candidate = priority.poll();
            if (untried.remove(candidate)) next = candidate;
        }
        if (next == null) {
            int i = rnd.nextInt(untried.size());
            Collections.swap(untried, i, untried.size() - 1);
            next = untried.remove(untried.size() - 1);
        }

        WatarutoState childState = engine.copy(state);
        engine.applyMove(childState, next);
        SearchNode child = new SearchNode(childState, this, next, next.player(), new ArrayList<>(engine.legalMoves(childState)));
        children.add(child);
        return child;
    }

    /** 回传一次模拟结果；胜者为 null 即和棋，双方各记半分 */
    void update(Player winner) {
        visits++;
        if (winner == null) score += 0.5;
        else if (winner == actor) score += 1.0;
    }

    /** 稳健子节点：取访问数最多，而不是胜率最高 */
    SearchNode mostVisitedChild() {
        SearchNode best = null;
        for (SearchNode child : children) {
            if (best == null || child.visits > best.visits) best = child;
        }
        return best;
    }

    double winRate() {
        return visits == 0 ? 0.0 : score / visits;
    }

    WatarutoState state() {
        return state;
    }

    SearchNode parent() {
        return parent;
    }

    Move move() {
        return move;
    }

    Player actor() {
        return actor;
    }

    int visits() {
        return visits;
    }

    double score() {
        return score;
    }

    List<SearchNode> children() {
        return Collections.unmodifiableList(children);
    }

    int untriedCount() {
        return untried.size();
    }
}
