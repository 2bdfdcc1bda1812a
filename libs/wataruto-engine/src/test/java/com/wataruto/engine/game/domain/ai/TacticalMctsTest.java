package com.wataruto.engine.game.domain.ai;

import com.wataruto.engine.core.CandidateStat;
import com.wataruto.engine.core.SearchConfig;
import com.wataruto.engine.core.SearchResult;
import com.wataruto.engine.game.domain.exception.NoLegalMovesException;
import com.wataruto.engine.game.domain.model.Layer;
import com.wataruto.engine.game.domain.model.Move;
import com.wataruto.engine.game.domain.model.Player;
import com.wataruto.engine.game.domain.model.WatarutoState;
import com.wataruto.engine.game.service.RulesEngine;
import com.wataruto.engine.game.support.GameFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wataruto.engine.game.support.GameFactory.vertical;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TacticalMctsTest {

    private final RulesEngine engine = GameFactory.engine();
    private final TacticalMcts mcts = new TacticalMcts(engine);

    private static SearchConfig.SearchConfigBuilder config() {
        return SearchConfig.builder().seed(7L).timeLimitSeconds(30);
    }

    @Nested
    @DisplayName("root checks")
    class RootTests {

        @Test
        void immediateWinNeedsNoSimulation() {
            WatarutoState s = GameFactory.anchoredColumn(engine);

            SearchResult<Move> result = mcts.search(s, config().maxSimulations(0).build());

            assertEquals(SearchResult.Reason.IMMEDIATE_WIN, result.getReason());
            assertEquals(0, result.getSimulations());
            assertTrue(engine.immediateWins(s, Player.A, 1000).contains(result.getMove()));
            assertEquals(1, result.getTopCandidates().size());
            assertEquals(1.0, result.getTopCandidates().get(0).winRate());

            engine.applyMove(s, result.getMove());
            assertEquals(Player.A, s.getWinner());
        }

        @Test
        void immediateWinIgnoresTheTimeBudget() {
            WatarutoState s = engine.newGame(5);

            Move move = mcts.suggest(s, config().timeLimitSeconds(0).build());

            engine.applyMove(s, move);
            assertEquals(Player.A, s.getWinner());
        }

        @Test
        void threatIsBlockedWithoutSimulations() {
            WatarutoState s = GameFactory.threatenedByB(engine);

            SearchResult<Move> result = mcts.search(s, config().maxSimulations(0).build());

            assertEquals(SearchResult.Reason.BLOCK_FALLBACK, result.getReason());
            engine.applyMove(s, result.getMove());
            assertTrue(engine.immediateWins(s, Player.B, 10).isEmpty());
        }

        @Test
        void blockingMovesAreExpandedFirst() {
            WatarutoState s = GameFactory.threatenedByB(engine);

            SearchResult<Move> result = mcts.search(s, config().maxSimulations(1).build());

            assertEquals(SearchResult.Reason.TREE_SEARCH, result.getReason());
            assertEquals(1, result.getSimulations());
            engine.applyMove(s, result.getMove());
            assertTrue(engine.immediateWins(s, Player.B, 10).isEmpty());
        }

        @Test
        void zeroBudgetStillAnswersWithALegalMove() {
            WatarutoState s = engine.newGame();

            SearchResult<Move> result = mcts.search(s, config().timeLimitSeconds(0).build());

            assertEquals(SearchResult.Reason.RANDOM, result.getReason());
            assertEquals(0, result.getSimulations());
            assertTrue(engine.legalMoves(s).contains(result.getMove()));
        }
    }

    @Nested
    @DisplayName("tree search")
    class TreeSearchTests {

        @Test
        void runsTheRequestedSimulations() {
            WatarutoState s = engine.newGame(7);

            SearchResult<Move> result = mcts.search(s, config().maxSimulations(60).build());

            assertEquals(SearchResult.Reason.TREE_SEARCH, result.getReason());
            assertEquals(60, result.getSimulations());
            assertTrue(result.getNodesCreated() > 1);
            assertTrue(engine.legalMoves(s).contains(result.getMove()));

            List<CandidateStat<Move>> top = result.getTopCandidates();
            assertTrue(top.size() <= 5 && !top.isEmpty());
            assertEquals(result.getMove(), top.get(0).move());
            for (int i = 1; i < top.size(); i++) {
                assertTrue(top.get(i - 1).visits() >= top.get(i).visits());
            }
        }

        @Test
        void unboundedTimeIsCappedBySimulations() {
            WatarutoState s = engine.newGame(7);

            for (double seconds : new double[]{1.0E10, Double.POSITIVE_INFINITY}) {
                SearchResult<Move> result = mcts.search(s, config().timeLimitSeconds(seconds).maxSimulations(50).build());

                assertEquals(SearchResult.Reason.TREE_SEARCH, result.getReason());
                assertEquals(50, result.getSimulations());
            }
        }

        @Test
        void budgetConversionSaturates() {
            assertEquals(0L, TacticalMcts.budgetNanos(0));
            assertEquals(0L, TacticalMcts.budgetNanos(-3));
            assertEquals(0L, TacticalMcts.budgetNanos(Double.NaN));
            assertEquals(1_500_000_000L, TacticalMcts.budgetNanos(1.5));
            assertEquals(Long.MAX_VALUE, TacticalMcts.budgetNanos(1.0E10));
            assertEquals(Long.MAX_VALUE, TacticalMcts.budgetNanos(Double.POSITIVE_INFINITY));
        }

        @Test
        void callerStateIsNotTouched() {
            WatarutoState s = GameFactory.threatenedByB(engine);
            WatarutoState before = engine.copy(s);

            mcts.search(s, config().maxSimulations(40).build());

            assertTrue(s.getBoard().sameContent(before.getBoard()));
            assertEquals(before.getHistory(), s.getHistory());
            assertEquals(before.getCurrent(), s.getCurrent());
            assertEquals(before.blocks(Player.A), s.blocks(Player.A));
        }

        @Test
        void pureRandomRolloutsWork() {
            WatarutoState s = engine.newGame(6);

            SearchResult<Move> result = mcts.search(s, config().maxSimulations(30).tacticalRollout(false).build());

            assertEquals(30, result.getSimulations());
            assertTrue(engine.legalMoves(s).contains(result.getMove()));
        }

        @Test
        void searchesForTheSideToMove() {
            WatarutoState s = engine.newGame(7);
            engine.applyMove(s, vertical(Player.A, Layer.PRIMARY, 0, 3, 3));

            Move move = mcts.suggest(s, config().maxSimulations(20).build());

            assertEquals(Player.B, move.player());
        }

        @Test
        void nullConfigMeansDefaults() {
            assertEquals(SearchResult.Reason.IMMEDIATE_WIN, mcts.search(engine.newGame(5), null).getReason());
        }
    }

    @Test
    void positionWithoutMovesIsRefused() {
        WatarutoState stuck = engine.restore(GameFactory.stalemateSnapshot());
        WatarutoState finished = engine.newGame(5);
        engine.applyMove(finished, vertical(Player.A, Layer.PRIMARY, 0, 0, 5));

        assertThrows(NoLegalMovesException.class, () -> mcts.search(stuck, config().build()));
        assertThrows(NoLegalMovesException.class, () -> mcts.search(finished, config().build()));
    }
}
