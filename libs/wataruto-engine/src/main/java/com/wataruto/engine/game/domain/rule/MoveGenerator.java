package com.wataruto.engine.game.domain.rule;

import com.wataruto.engine.game.domain.model.Board;
import com.wataruto.engine.game.domain.model.Layer;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.PlayerBlocks;
import com.wataruto.engine.game.domain.model.Position;
import com.wataruto.engine.game.domain.model.WatarutoState;

import java.util.ArrayList;
import java.util.List;

/**
 * 合法着法生成。
 * <p>
 * 从起点格沿一个轴向逐格延伸，直到下一格不可用、到达边界或长度到 5；
 * 长度不小于 3 的每个前缀都是候选。
 * <ul>
 *   <li>起点是空格：primary 模式，每格必须两层全空；</li>
 *   <li>起点是己方 primary 棋子：架桥模式，每格写入 secondary 层，
 *       遇到对方 primary 棋子即停，且终点必须落在己方 primary 棋子上（锚点）；</li>
 *   <li>长度 4、5 需要落子方还有对应长条。</li>
 * </ul>
 */
public final class MoveGenerator {

    /** 规则对称，LEFT/UP 延伸只是 RIGHT/DOWN 的反向重复 */
    private static final Direction[] FORWARD = {Direction.RIGHT, Direction.DOWN};

    private MoveGenerator() {
    }

    /** 行棋方的全部合法着法，同一步只出现一次；终局时为空 */
    public static List<Move> legalMoves(WatarutoState s) {
        return scan(s, true);
    }

    /**
     * 全盘扫描。
     *
     * @param dedupe 为 false 时四个方向都走，保留反向重复
     */
    public static List<Move> scan(WatarutoState s, boolean dedupe) {
        if (s.isOver()) return List.of();

        Player me = s.getCurrent();
        Board b = s.getBoard();
        PlayerBlocks inventory = s.blocks(me);
        Direction[] directions = dedupe ? FORWARD : Direction.values();
        long timestamp = System.currentTimeMillis(); // 同一批共用
        int n = b.size();

        List<Move> moves = new ArrayList<>();
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                Layer mode = startMode(b, row, col, me);
                if (mode == null) continue;

                for (Direction d : directions) {
                    List<Position> path = new ArrayList<>(Move.MAX_LENGTH);
                    path.add(new Position(row, col, mode));
                    int r = row, c = col;
                    while (path.size() < Move.MAX_LENGTH) {
                        r += d.dr;
                        c += d.dc;
                        if (!canExtend(b, r, c, mode, me)) break;
                        path.add(new Position(r, c, mode));

                        if (path.size() < Move.MIN_LENGTH) continue;
                        // 架桥不能造新锚点，只能落在已有锚点上
                        if (mode == Layer.SECONDARY && b.primary(r, c) != me) continue;
                        if (!inventory.has(path.size())) continue;
                        moves.add(new Move(me, path, timestamp));
                    }
                }
            }
        }
        return moves;
    }

    /**
     * 从 (row, col) 起步时的模式：空格为 PRIMARY，己方 primary 棋子且 secondary 空为 SECONDARY，
     * 不能起步返回 null。
     */
    static Layer startMode(Board b, int row, int col, Player me) {
        if (!b.inBounds(row, col) || b.secondary(row, col) != null) return null;
        Player primary = b.primary(row, col);
        if (primary == null) return Layer.PRIMARY;
        if (primary == me) return Layer.SECONDARY;
        return null;
    }

    /** 该模式下能否延伸到 (row, col) */
    static boolean canExtend(Board b, int row, int col, Layer mode, Player me) {
        if (!b.inBounds(row, col) || b.secondary(row, col) != null) return false;
        Player primary = b.primary(row, col);
        if (mode == Layer.PRIMARY) return primary == null;
        return primary == null || primary == me;
    }
}
