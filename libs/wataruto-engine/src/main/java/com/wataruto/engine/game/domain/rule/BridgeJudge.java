package com.wataruto.engine.game.domain.rule;

import com.wataruto.engine.game.domain.model.Board;
import com.wataruto.engine.game.domain.model.Player;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 胜负判定。
 * 任一层是该玩家，这格就算该玩家的。A 需一条四连通的己方格子链从第 0 行连到最后一行，
 * B 需从第 0 列连到最后一列。
 */
public final class BridgeJudge {

    private static final int[][] NEIGHBOURS = {
            {1, 0},   // 下
            {-1, 0},  // 上
            {0, 1},   // 右
            {0, -1}   // 左
    };

    private BridgeJudge() {
    }

    /**
     * 从起始边上每个己方格子做深度优先泛洪；一旦到达对边即返回 true。
     */
    public static boolean hasBridge(Board b, Player player) {
        int n = b.size();
        boolean[][] visited = new boolean[n][n];
        Deque<int[]> stack = new ArrayDeque<>();

        // 起点：A 从上边，B 从左边
        for (int i = 0; i < n; i++) {
            int r = player == Player.A ? 0 : i;
            int c = player == Player.A ? i : 0;
            if (b.belongsTo(r, c, player)) {
                visited[r][c] = true;
                stack.push(new int[]{r, c});
            }
        }

        while (!stack.isEmpty()) {
            int[] cell = stack.pop();
            int r = cell[0], c = cell[1];
            if (player == Player.A ? r == n - 1 : c == n - 1) return true;
            for (int[] d : NEIGHBOURS) {
                int nr = r + d[0], nc = c + d[1];
                if (b.inBounds(nr, nc) && !visited[nr][nc] && b.belongsTo(nr, nc, player)) {
                    visited[nr][nc] = true;
                    stack.push(new int[]{nr, nc});
                }
            }
        }
        return false;
    }

    /** 仅看棋盘的结果；无子可下要靠着法生成，由引擎判断 */
    public static Outcome outcomeOf(Board b) {
        if (hasBridge(b, Player.A)) return Outcome.A_WINS;
        if (hasBridge(b, Player.B)) return Outcome.B_WINS;
        return Outcome.ONGOING;
    }
}
