package com.wataruto.engine.game.domain.dto;

import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.PlayerBlocks;
import com.wataruto.engine.game.domain.rule.Outcome;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 对局状态摘要（只读），用于状态展示。
 */
@Data
@Builder
public class GameInfo {
    private int boardSize;
    private Player currentPlayer;
    private int moveCount;
    private Map<Player, PlayerBlocks> inventory;
    private Player winner;
    private boolean over;
    private int legalMoveCount;
    private Outcome outcome;
}
