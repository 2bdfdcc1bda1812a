package com.wataruto.engine.game.domain.dto;

import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * GameRecord
 * -------------------------------------------------------
 * 可重放的棋谱：初始配置 + 按顺序的着法。
 * 不保存棋盘本身；在 {@code boardSize} 的新棋盘上重放 {@code moves} 即可还原。
 * -------------------------------------------------------
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameRecord {
    /** 棋盘边长 */
    private int boardSize;
    /** 按落子顺序 */
    private List<Move> moves = new ArrayList<>();
    /** 导出时的胜者，进行中为 null；导入时与重放结果核对 */
    private Player winner;
}
