package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.core.AiAdvisor;
import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.core.SearchResult;
import com.wataruto.engine.game.domain.constants.GameMessages;
import com.wataruto.engine.game.domain.exception.NoLegalMovesException;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/** 简单难度：均匀随机选一个合法着法。配置里只读 seed。 */
@Component
@RequiredArgsConstructor
public class RandomAdvisor implements AiAdvisor<WatarutoState, Move> {

    private final RulesEngine engine;

    @Override
    public SearchResult<Move> search(WatarutoState state, SearchConfig config) {
        List<Move> moves = engine.legalMoves(state);
        if (moves.isEmpty()) {
            throw new NoLegalMovesException(GameMessages.formatNoLegalMoves(state.getCurrent()));
        }
        Random rnd = config != null && config.getSeed() != null ? new Random(config.getSeed()) : new Random();
        return SearchResult.<Move>builder()
                .move(moves.get(rnd.nextInt(moves.size())))
                .reason(SearchResult.Reason.RANDOM)
                .build();
    }
}
