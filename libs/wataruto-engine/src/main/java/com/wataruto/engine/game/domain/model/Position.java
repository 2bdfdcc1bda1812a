package com.wataruto.engine.game.domain.model;

/**
 * 落子路径上的一格，以及这步写入的层。
 */
public record Position(int row, int col, Layer layer) {

    public static Position primary(int row, int col) {
        return new Position(row, col, Layer.PRIMARY);
    }

    public static Position secondary(int row, int col) {
        return new Position(row, col, Layer.SECONDARY);
    }

    public boolean sameCell(Position other) {
        return row == other.row && col == other.col;
    }
}
