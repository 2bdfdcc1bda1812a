package com.wataruto.engine.game.service;

import com.wataruto.engine.game.domain.dto.GameInfo;
import com.wataruto.engine.game.domain.dto.GameRecord;
import com.wataruto.engine.game.domain.dto.GameSnapshot;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.domain.rule.Outcome;

import java.util.List;
import java.util.Optional;

/**
 * 规则引擎：轮次、合法着法、落子、悔棋、胜负判定以及棋谱导入导出。
 * <p>
 * 引擎本身不持有对局，每次调用只操作传入的状态，并发访问由调用方串行化。
 * 被拒绝的操作不改动状态。
 */
public interface RulesEngine {

    /** 按配置的默认边长开新局，A 先手 */
    WatarutoState newGame();

    /** 开一局 size x size 的新局；边长小于 3 拒绝 */
    WatarutoState newGame(int size);

    /** 当前行棋方的全部合法着法，同一步只出现一次；终局时为空 */
    List<Move> legalMoves(WatarutoState state);

    /**
     * 校验并落子。连通即终局，落子方获胜，轮次不再切换；否则轮到对方。
     *
     * @throws com.wataruto.engine.game.domain.exception.IllegalMoveException 非己方回合、形状非法、
     *         格子被占、长条用尽或对局已结束
     */
    void applyMove(WatarutoState state, Move move);

    /**
     * 撤回最后一步：格子、库存、行棋方、胜者都恢复到这步之前。可连续悔棋。
     *
     * @throws com.wataruto.engine.game.domain.exception.NothingToUndoException 没有历史可撤
     */
    Move undo(WatarutoState state);

    /** 独立深拷贝（先拷贝再落子） */
    WatarutoState copy(WatarutoState state);

    /** ONGOING / A_WINS / B_WINS；行棋方无子可下时报 STALEMATE（只报告，不判终局） */
    Outcome outcome(WatarutoState state);

    /**
     * {@code side} 一步即可连通的着法，最多扫描 {@code limit} 个候选，按潜力从高到低。
     * 与当前轮到谁无关。
     */
    List<Move> immediateWins(WatarutoState state, Player side, int limit);

    /** 候选（行棋方的着法）中第一个一步制胜的 */
    Optional<Move> winningMove(WatarutoState state, List<Move> candidates);

    /** 初始配置 + 按顺序的着法 */
    GameRecord exportRecord(WatarutoState state);

    /**
     * 从初始配置重放棋谱。
     *
     * @throws com.wataruto.engine.game.domain.exception.IllegalMoveException 棋谱中有非法着法
     */
    WatarutoState importRecord(GameRecord record);

    /** 状态的完整快照（传输用） */
    GameSnapshot snapshot(WatarutoState state);

    /**
     * 由快照重建状态。
     *
     * @throws IllegalArgumentException 快照自相矛盾（尺寸、库存不符，或有胜者却没有连通）
     */
    WatarutoState restore(GameSnapshot snapshot);

    /** 状态摘要 */
    GameInfo info(WatarutoState state);
}
