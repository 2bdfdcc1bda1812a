package com.wataruto.engine.game.domain.rule;

import com.wataruto.engine.game.domain.constants.GameMessages;
import com.wataruto.engine.game.domain.exception.IllegalMoveException;
import com.wataruto.engine.game.domain.model.Board;
import com.wataruto.engine.game.domain.model.Layer;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.Position;
import com.wataruto.engine.game.domain.model.WatarutoState;

import java.util.List;

/**
 * 校验一步不一定来自 {@link MoveGenerator} 的落子（客户端、棋谱导入等外部来源）。
 * 只判定不写入：任何不合法都抛 {@link IllegalMoveException}。
 */
public final class MoveValidator {

    private MoveValidator() {
    }

    public static void validate(WatarutoState s, Move m) {
        if (s.isOver()) {
            throw new IllegalMoveException(GameMessages.GAME_OVER);
        }
        if (m.player() != s.getCurrent()) {
            throw new IllegalMoveException(GameMessages.formatNotYourTurn(m.player(), s.getCurrent()));
        }
        validateShape(m);
        if (!s.blocks(m.player()).has(m.length())) {
            throw new IllegalMoveException(GameMessages.formatNoBlock(m.length()));
        }
        validatePlacement(s.getBoard(), m);
    }

    /** 长度 3~5；每格都有坐标和层；同一行或同一列，每步恰好同方向移动一格 */
    static void validateShape(Move m) {
        List<Position> path = m.path();
        if (path.size() < Move.MIN_LENGTH || path.size() > Move.MAX_LENGTH) {
            throw new IllegalMoveException(GameMessages.formatInvalidLength(path.size()));
        }
        for (int i = 0; i < path.size(); i++) {
            Position p = path.get(i);
            if (p == null || p.layer() == null) {
                throw new IllegalMoveException(GameMessages.formatIncompleteCell(i));
            }
        }
        Position first = path.get(0), second = path.get(1);
        int dr = second.row() - first.row();
        int dc = second.col() - first.col();
        if (Math.abs(dr) + Math.abs(dc) != 1) {
            throw new IllegalMoveException(GameMessages.NOT_STRAIGHT);
        }
        for (int i = 1; i < path.size(); i++) {
            Position prev = path.get(i - 1), cur = path.get(i);
            if (cur.row() - prev.row() != dr || cur.col() - prev.col() != dc) {
                throw new IllegalMoveException(GameMessages.NOT_STRAIGHT);
            }
        }
    }

    private static void validatePlacement(Board b, Move m) {
        Player me = m.player();
        Layer mode = m.start().layer();
        for (int i = 0; i < m.length(); i++) {
            Position p = m.path().get(i);
            int r = p.row(), c = p.col();
            if (!b.inBounds(r, c)) {
                throw new IllegalMoveException(GameMessages.formatOutOfBounds(r, c));
            }
            if (b.secondary(r, c) != null) {
                throw new IllegalMoveException(GameMessages.at(GameMessages.SECONDARY_OCCUPIED, r, c));
            }
            if (p.layer() != mode) {
                throw new IllegalMoveException(GameMessages.at(GameMessages.MIXED_LAYERS, r, c));
            }
            Player primary = b.primary(r, c);
            if (mode == Layer.PRIMARY) {
                if (primary != null) {
                    throw new IllegalMoveException(GameMessages.at(GameMessages.PRIMARY_NOT_EMPTY, r, c));
                }
            } else if (i == 0) {
                if (primary != me) {
                    throw new IllegalMoveException(GameMessages.at(GameMessages.START_NEEDS_OWN_COLOR, r, c));
                }
            } else if (primary != null && primary != me) {
                throw new IllegalMoveException(GameMessages.at(GameMessages.OPPONENT_COLOR, r, c));
            }
        }
        if (mode == Layer.SECONDARY) {
            Position end = m.end();
            if (b.primary(end.row(), end.col()) != me) {
                throw new IllegalMoveException(GameMessages.BRIDGE_NEEDS_ANCHOR);
            }
        }
    }
}
