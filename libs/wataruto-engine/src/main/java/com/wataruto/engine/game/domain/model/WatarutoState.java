package com.wataruto.engine.game.domain.model;

import com.wataruto.engine.core.GameState;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 一局游戏的唯一真相源：棋盘、行棋方、长条库存、着法历史、胜者。
 * <p>
 * 这里只改状态不做规则判断；合法性、胜负由 rule 包负责，规则引擎统一调度。
 * {@link #copy()} 为深拷贝，AI 搜索不会碰到真实对局。
 */
@Getter
public class WatarutoState implements GameState {

    private final Board board;

    /** 当前行棋方；终局后停在胜者 */
    private Player current = Player.A;

    @Getter(AccessLevel.NONE)
    private final Map<Player, PlayerBlocks> blocks = new EnumMap<>(Player.class);

    private final List<Move> history = new ArrayList<>();

    /** 对局进行中为 null */
    private Player winner;

    public WatarutoState(int size) {
        this(new Board(size));
    }

    private WatarutoState(Board board) {
        this.board = board;
        for (Player p : Player.values()) blocks.put(p, PlayerBlocks.initial());
    }

    public int size() {
        return board.size();
    }

    public boolean isOver() {
        return winner != null;
    }

    public PlayerBlocks blocks(Player player) {
        return blocks.get(player);
    }

    public List<Move> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Move lastMove() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    // --------- 状态变更，由规则引擎调用 ---------

    /** 写入路径、扣长条、记录着法。调用前须已校验合法。 */
    public void apply(Move m) {
        for (Position p : m.path()) {
            board.place(p.row(), p.col(), p.layer(), m.player());
        }
        blocks.get(m.player()).use(m.length());
        history.add(m);
    }

    public void passTurn() {
        current = current.opponent();
    }

    public void setOver(Player winner) {
        this.winner = winner;
    }

    /**
     * 撤回最后一步：清掉它写过的层、归还长条、轮次交还给它的玩家、清空胜者。
     *
     * @return 被撤回的着法；历史为空时返回 null
     */
    public Move retract() {
        if (history.isEmpty()) return null;
        Move last = history.remove(history.size() - 1);
        for (Position p : last.path()) {
            board.clear(p.row(), p.col(), p.layer());
        }
        blocks.get(last.player()).restore(last.length());
        current = last.player();
        winner = null;
        return last;
    }

    /** 同一局面换一方行棋，用来看“对方现在能下什么” */
    public WatarutoState withSideToMove(Player side) {
        WatarutoState s = copy();
        s.current = side;
        return s;
    }

    /** 由各部分重建状态，一致性由调用方保证 */
    public static WatarutoState restore(Board board, Player current, Map<Player, PlayerBlocks> blocks,
                                        List<Move> history, Player winner) {
        WatarutoState s = new WatarutoState(board.copy());
        s.current = current;
        for (Player p : Player.values()) {
            PlayerBlocks pb = blocks.get(p);
            if (pb != null) s.blocks.put(p, pb.copy());
        }
        s.history.addAll(history);
        s.winner = winner;
        return s;
    }

    /** 深拷贝：棋盘、库存复制一份，着法不可变所以共享 */
    @Override
    public WatarutoState copy() {
        WatarutoState s = new WatarutoState(board.copy());
        s.current = this.current;
        for (Player p : Player.values()) s.blocks.put(p, blocks.get(p).copy());
        s.history.addAll(this.history);
        s.winner = this.winner;
        return s;
    }
}
