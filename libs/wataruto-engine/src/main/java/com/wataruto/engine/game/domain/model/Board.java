package com.wataruto.engine.game.domain.model;

/**
 * 边长 {@code size} 的方形棋盘；每格有 PRIMARY、SECONDARY 两层。
 * 空位为 {@code null}。
 * <p>
 * 除越界外这里不做校验，能不能下由规则层决定。
 */
public class Board {

    /** 未指定时新棋盘的边长 */
    public static final int DEFAULT_SIZE = 18;

    private final int size;

    /** grid[行][列][层下标] */
    private final Player[][][] grid;

    public Board(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("board size must be positive: " + size);
        }
        this.size = size;
        this.grid = new Player[size][size][2];
    }

    public int size() {
        return size;
    }

    /** (row, col) 是否在棋盘内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /** 某一层的占有者，空为 null */
    public Player get(int row, int col, Layer layer) {
        checkBounds(row, col);
        return grid[row][col][layer.index()];
    }

    public Player primary(int row, int col) {
        return get(row, col, Layer.PRIMARY);
    }

    public Player secondary(int row, int col) {
        return get(row, col, Layer.SECONDARY);
    }

    /** 两层都空；越界返回 false */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col)
                && grid[row][col][0] == null
                && grid[row][col][1] == null;
    }

    public boolean isEmpty(int row, int col, Layer layer) {
        return inBounds(row, col) && grid[row][col][layer.index()] == null;
    }

    /** 任一层是该玩家，这格就算该玩家的 */
    public boolean belongsTo(int row, int col, Player player) {
        if (!inBounds(row, col)) return false;
        Player[] cell = grid[row][col];
        return cell[0] == player || cell[1] == player;
    }

    public void place(int row, int col, Layer layer, Player player) {
        checkBounds(row, col);
        grid[row][col][layer.index()] = player;
    }

    public void clear(int row, int col, Layer layer) {
        place(row, col, layer, null);
    }

    /** 深拷贝，不共享任何数组 */
    public Board copy() {
        Board b = new Board(size);
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                b.grid[r][c][0] = grid[r][c][0];
                b.grid[r][c][1] = grid[r][c][1];
            }
        }
        return b;
    }

    /** 序列化用的嵌套数组快照 [行][列][层] */
    public Player[][][] view() {
        Player[][][] v = new Player[size][size][];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                v[r][c] = grid[r][c].clone();
            }
        }
        return v;
    }

    /** 由 {@link #view()} 的结果重建棋盘 */
    public static Board fromView(Player[][][] view) {
        Board b = new Board(view.length);
        for (int r = 0; r < view.length; r++) {
            if (view[r] == null) {
                throw new IllegalArgumentException("board row " + r + " is missing");
            }
            if (view[r].length != view.length) {
                throw new IllegalArgumentException("board rows must be square, row " + r + " has " + view[r].length);
            }
            for (int c = 0; c < view.length; c++) {
                Player[] cell = view[r][c];
                if (cell == null || cell.length != 2) {
                    throw new IllegalArgumentException("cell (" + r + "," + c + ") must have two layers");
                }
                b.grid[r][c][0] = cell[0];
                b.grid[r][c][1] = cell[1];
            }
        }
        return b;
    }

    /** 某玩家每层的棋子数：[primary, secondary] */
    public int[] countStones(Player player) {
        int[] counts = new int[2];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                if (grid[r][c][0] == player) counts[0]++;
                if (grid[r][c][1] == player) counts[1]++;
            }
        }
        return counts;
    }

    public boolean sameContent(Board other) {
        if (other == null || other.size != size) return false;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                if (grid[r][c][0] != other.grid[r][c][0] || grid[r][c][1] != other.grid[r][c][1]) {
                    return false;
                }
            }
        }
        return true;
    }

    private void checkBounds(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IllegalArgumentException("position out of board: (" + row + "," + col + ")");
        }
    }
}
