package com.wataruto.engine.game.service.impl;

import com.wataruto.engine.config.WatarutoEngineProperties;
import com.wataruto.engine.game.domain.constants.GameMessages;
import com.wataruto.engine.game.domain.dto.GameInfo;
import com.wataruto.engine.game.domain.dto.GameRecord;
import com.wataruto.engine.game.domain.dto.GameSnapshot;
import com.wataruto.engine.game.domain.exception.IllegalMoveException;
import com.wataruto.engine.game.domain.exception.NothingToUndoException;
import com.wataruto.engine.game.domain.model.Board;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.PlayerBlocks;
import com.wataruto.engine.game.domain.model.Position;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.domain.rule.BridgeJudge;
import com.wataruto.engine.game.domain.rule.MoveGenerator;
import com.wataruto.engine.game.domain.rule.MoveValidator;
import com.wataruto.engine.game.domain.rule.Outcome;
import com.wataruto.engine.game.service.RulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;


@Slf4j
@Service
@RequiredArgsConstructor
public class RulesEngineImpl implements RulesEngine {

    /** 能放下 3 格长条的最小棋盘 */
    public static final int MIN_SIZE = Move.MIN_LENGTH;

    private final WatarutoEngineProperties properties;

    @Override
    public WatarutoState newGame() {
        return newGame(properties.getBoard().getDefaultSize());
    }

    @Override
    public WatarutoState newGame(int size) {
        if (size < MIN_SIZE) {
            throw new IllegalArgumentException("board size must be at least " + MIN_SIZE + ": " + size);
        }
        return new WatarutoState(size);
    }

    @Override
    public List<Move> legalMoves(WatarutoState state) {
        return MoveGenerator.legalMoves(state);
    }

    @Override
    public void applyMove(WatarutoState state, Move move) {
        Objects.requireNonNull(move, "move must not be null");
        try {
            MoveValidator.validate(state, move);
        } catch (IllegalMoveException e) {
            log.debug("Move refused: {} -> {}", move, e.getMessage());
            throw e;
        }

        // 1) 写格子、扣长条、记历史
        state.apply(move);

        // 2) 这一步只可能让落子方连通
        if (BridgeJudge.hasBridge(state.getBoard(), move.player())) {
            state.setOver(move.player());
            log.debug("Player {} bridged with {} after {} moves", move.player(), move, state.getHistory().size());
            return;
        }

        // 3) 换手
        state.passTurn();
    }

    @Override
    public Move undo(WatarutoState state) {
        Move last = state.retract();
        if (last == null) {
            throw new NothingToUndoException(GameMessages.NOTHING_TO_UNDO);
        }
        return last;
    }

    @Override
    public WatarutoState copy(WatarutoState state) {
        return state.copy();
    }

    @Override
    public Outcome outcome(WatarutoState state) {
        if (state.getWinner() != null) return Outcome.winOf(state.getWinner());
        if (MoveGenerator.legalMoves(state).isEmpty()) return Outcome.STALEMATE;
        return Outcome.ONGOING;
    }

    @Override
    public List<Move> immediateWins(WatarutoState state, Player side, int limit) {
        if (state.isOver() || limit <= 0) return List.of();

        // 同一局面换成 side 行棋；逐个试下再原地撤回
        WatarutoState trial = state.withSideToMove(side);
        List<Move> candidates = new ArrayList<>(MoveGenerator.legalMoves(trial));
        Board board = trial.getBoard();
        candidates.sort(Comparator.comparingInt((Move m) -> promise(board, m)).reversed());

        List<Move> wins = new ArrayList<>();
        int n = Math.min(limit, candidates.size());
        for (int i = 0; i < n; i++) {
            Move m = candidates.get(i);
            if (winsAt(trial, m)) wins.add(m);
        }
        return wins;
    }

    @Override
    public Optional<Move> winningMove(WatarutoState state, List<Move> candidates) {
        if (state.isOver() || candidates.isEmpty()) return Optional.empty();
        WatarutoState trial = state.copy();
        for (Move m : candidates) {
            if (m.player() == trial.getCurrent() && winsAt(trial, m)) return Optional.of(m);
        }
        return Optional.empty();
    }

    @Override
    public GameRecord exportRecord(WatarutoState state) {
        return new GameRecord(state.size(), new ArrayList<>(state.getHistory()), state.getWinner());
    }

    @Override
    public WatarutoState importRecord(GameRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        WatarutoState state = newGame(record.getBoardSize());
        List<Move> moves = record.getMoves() == null ? List.of() : record.getMoves();
        for (int i = 0; i < moves.size(); i++) {
            Move m = moves.get(i);
            if (m == null) {
                throw new IllegalArgumentException("record move " + i + " is missing");
            }
            applyMove(state, m);
        }
        if (record.getWinner() != state.getWinner()) {
            throw new IllegalArgumentException("record winner " + record.getWinner()
                    + " does not match replayed winner " + state.getWinner());
        }
        log.debug("Replayed record: size={}, moves={}, winner={}", record.getBoardSize(), moves.size(), state.getWinner());
        return state;
    }

    @Override
    public GameSnapshot snapshot(WatarutoState state) {
        GameSnapshot snap = new GameSnapshot();
        snap.setBoardSize(state.size());
        snap.setBoard(state.getBoard().view());
        snap.setCurrentPlayer(state.getCurrent());
        snap.setInventory(inventoryOf(state));
        snap.setHistory(new ArrayList<>(state.getHistory()));
        snap.setWinner(state.getWinner());
        return snap;
    }

    @Override
    public WatarutoState restore(GameSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (snapshot.getBoard() == null || snapshot.getBoard().length != snapshot.getBoardSize()) {
            throw new IllegalArgumentException("snapshot board does not match boardSize " + snapshot.getBoardSize());
        }
        if (snapshot.getBoardSize() < MIN_SIZE) {
            throw new IllegalArgumentException("board size must be at least " + MIN_SIZE + ": " + snapshot.getBoardSize());
        }
        if (snapshot.getCurrentPlayer() == null) {
            throw new IllegalArgumentException("snapshot has no current player");
        }
        Map<Player, PlayerBlocks> inventory = snapshot.getInventory();
        for (Player p : Player.values()) {
            PlayerBlocks pb = inventory == null ? null : inventory.get(p);
            if (pb == null || pb.getLen4() < 0 || pb.getLen5() < 0) {
                throw new IllegalArgumentException("snapshot inventory missing or negative for " + p);
            }
        }
        Board board = Board.fromView(snapshot.getBoard());
        Player winner = snapshot.getWinner();
        if (winner != null && !BridgeJudge.hasBridge(board, winner)) {
            throw new IllegalArgumentException("snapshot winner " + winner + " has no bridge on the board");
        }
        List<Move> history = snapshot.getHistory() == null ? List.of() : snapshot.getHistory();
        return WatarutoState.restore(board, snapshot.getCurrentPlayer(), inventory, history, winner);
    }

    @Override
    public GameInfo info(WatarutoState state) {
        return GameInfo.builder()
                .boardSize(state.size())
                .currentPlayer(state.getCurrent())
                .moveCount(state.getHistory().size())
                .inventory(inventoryOf(state))
                .winner(state.getWinner())
                .over(state.isOver())
                .legalMoveCount(legalMoves(state).size())
                .outcome(outcome(state))
                .build();
    }

    // ----------- 私有工具 -----------

    /** 在试算局面上落 m，看是否连通，再撤回。m 必须在该局面合法。 */
    private static boolean winsAt(WatarutoState trial, Move m) {
        trial.apply(m);
        boolean win = BridgeJudge.hasBridge(trial.getBoard(), m.player());
        trial.retract();
        return win;
    }

    /**
     * 制胜扫描用的粗略排序分：先比长度，再比落在己方目标边上的格数，
     * 最后比与己方棋子相邻的格数。
     */
    private static int promise(Board b, Move m) {
        int n = b.size();
        Player me = m.player();
        int edges = 0, contacts = 0;
        for (Position p : m.path()) {
            int r = p.row(), c = p.col();
            int lo = me == Player.A ? r : c;
            if (lo == 0 || lo == n - 1) edges++;
            if (b.belongsTo(r + 1, c, me)) contacts++;
            if (b.belongsTo(r - 1, c, me)) contacts++;
            if (b.belongsTo(r, c + 1, me)) contacts++;
            if (b.belongsTo(r, c - 1, me)) contacts++;
        }
        return m.length() * 100 + edges * 10 + contacts;
    }

    private static Map<Player, PlayerBlocks> inventoryOf(WatarutoState state) {
        Map<Player, PlayerBlocks> inv = new EnumMap<>(Player.class);
        for (Player p : Player.values()) inv.put(p, state.blocks(p).copy());
        return inv;
    }
}
