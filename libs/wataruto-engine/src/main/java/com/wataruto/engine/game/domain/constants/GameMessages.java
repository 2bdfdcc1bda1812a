package com.wataruto.engine.game.domain.constants;

/**
 * 规则拒绝时的提示文案，统一放这里，避免散落的字面量。
 *
 * 用法示例：
 *   throw new IllegalMoveException(GameMessages.formatNotYourTurn(Player.A));
 */
public final class GameMessages {

    private GameMessages() {
        // 常量类
    }

    // ========== 轮次与对局状态 ==========

    /** 对局已分胜负 */
    public static final String GAME_OVER = "Game is already over";

    /** 非当前行棋方提交落子 */
    public static final String NOT_YOUR_TURN = "Not player %s's turn (current: %s)";

    public static String formatNotYourTurn(Object player, Object current) {
        return String.format(NOT_YOUR_TURN, player, current);
    }

    /** 历史为空时悔棋 */
    public static final String NOTHING_TO_UNDO = "No move to undo";

    /** 在无合法着法的局面上搜索 */
    public static final String NO_LEGAL_MOVES = "No legal moves for player %s";

    public static String formatNoLegalMoves(Object player) {
        return String.format(NO_LEGAL_MOVES, player);
    }

    // ========== 路径形状 ==========

    public static final String INVALID_LENGTH = "Path length must be between 3 and 5, got %d";

    public static String formatInvalidLength(int length) {
        return String.format(INVALID_LENGTH, length);
    }

    /** 路径中某格缺失，或缺少层 */
    public static final String INCOMPLETE_CELL = "Invalid path: cell %d is missing or has no layer";

    public static String formatIncompleteCell(int index) {
        return String.format(INCOMPLETE_CELL, index);
    }

    public static final String NOT_STRAIGHT = "Invalid path: not straight or not continuous";

    public static final String OUT_OF_BOUNDS = "Position out of bounds: (%d,%d)";

    public static String formatOutOfBounds(int row, int col) {
        return String.format(OUT_OF_BOUNDS, row, col);
    }

    // ========== 长条库存 ==========

    public static final String NO_BLOCK = "No %d-size blocks available";

    public static String formatNoBlock(int length) {
        return String.format(NO_BLOCK, length);
    }

    // ========== 落子位置 ==========

    public static final String SECONDARY_OCCUPIED = "Layer 2 already occupied at (%d,%d)";

    public static final String PRIMARY_NOT_EMPTY = "Layer 1 not empty at (%d,%d)";

    public static final String START_NEEDS_OWN_COLOR = "Layer 1 must have player color at start position (%d,%d)";

    public static final String MIXED_LAYERS = "Every cell must target the start cell's layer, (%d,%d) does not";

    public static final String OPPONENT_COLOR = "Cannot place on opponent's color at (%d,%d)";

    public static final String BRIDGE_NEEDS_ANCHOR = "Bridge mode: end position must be on existing player tile";

    public static String at(String template, int row, int col) {
        return String.format(template, row, col);
    }
}
