package com.wataruto.engine.game.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.PlayerBlocks;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 交给传输层的完整状态。
 * {@code board} 为 [行][列][层]，空位为 null。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameSnapshot {
    private int boardSize;
    private Player[][][] board;
    private Player currentPlayer;
    /** 每个玩家剩余的 4 格、5 格长条 */
    private Map<Player, PlayerBlocks> inventory = new EnumMap<>(Player.class);
    private List<Move> history = new ArrayList<>();
    /** 进行中为 null */
    private Player winner;
}
