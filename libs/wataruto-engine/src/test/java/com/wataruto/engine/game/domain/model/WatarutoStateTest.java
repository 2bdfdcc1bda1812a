package com.wataruto.engine.game.domain.model;

import org.junit.jupiter.api.Test;

import static com.wataruto.engine.game.support.GameFactory.horizontal;
import static com.wataruto.engine.game.support.GameFactory.vertical;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatarutoStateTest {

    @Test
    void startsWithATurnAndFullInventories() {
        WatarutoState s = new WatarutoState(6);

        assertEquals(Player.A, s.getCurrent());
        assertEquals(6, s.size());
        assertTrue(s.getHistory().isEmpty());
        assertNull(s.getWinner());
        assertFalse(s.isOver());
        for (Player p : Player.values()) {
            assertEquals(1, s.blocks(p).getLen4());
            assertEquals(1, s.blocks(p).getLen5());
        }
    }

    @Test
    void applyWritesCellsAndConsumesBlock() {
        WatarutoState s = new WatarutoState(6);
        Move m = horizontal(Player.A, Layer.PRIMARY, 2, 1, 4);

        s.apply(m);

        for (int c = 1; c <= 4; c++) assertEquals(Player.A, s.getBoard().primary(2, c));
        assertEquals(0, s.blocks(Player.A).getLen4());
        assertSame(m, s.lastMove());
        // 状态只记录，换手归引擎管
        assertEquals(Player.A, s.getCurrent());
    }

    @Test
    void retractUndoesApply() {
        WatarutoState s = new WatarutoState(6);
        Move m = vertical(Player.A, Layer.PRIMARY, 0, 3, 5);
        s.apply(m);
        s.passTurn();

        assertSame(m, s.retract());

        assertTrue(s.getBoard().sameContent(new Board(6)));
        assertEquals(1, s.blocks(Player.A).getLen5());
        assertEquals(Player.A, s.getCurrent());
        assertTrue(s.getHistory().isEmpty());
    }

    @Test
    void retractClearsWinner() {
        WatarutoState s = new WatarutoState(5);
        s.apply(vertical(Player.A, Layer.PRIMARY, 0, 0, 5));
        s.setOver(Player.A);

        s.retract();

        assertFalse(s.isOver());
    }

    @Test
    void retractOnEmptyHistoryReturnsNull() {
        assertNull(new WatarutoState(5).retract());
    }

    @Test
    void copyIsIndependent() {
        WatarutoState s = new WatarutoState(6);
        s.apply(horizontal(Player.A, Layer.PRIMARY, 0, 0, 3));

        WatarutoState copy = s.copy();
        copy.apply(horizontal(Player.A, Layer.PRIMARY, 1, 0, 4));
        copy.passTurn();

        assertTrue(s.getBoard().isEmpty(1, 0));
        assertEquals(1, s.blocks(Player.A).getLen4());
        assertEquals(1, s.getHistory().size());
        assertEquals(Player.A, s.getCurrent());
    }

    @Test
    void withSideToMoveLeavesOriginalAlone() {
        WatarutoState s = new WatarutoState(5);

        WatarutoState trial = s.withSideToMove(Player.B);

        assertEquals(Player.B, trial.getCurrent());
        assertEquals(Player.A, s.getCurrent());
    }

    @Test
    void historyIsReadOnly() {
        WatarutoState s = new WatarutoState(5);

        assertThrows(UnsupportedOperationException.class,
                () -> s.getHistory().add(horizontal(Player.A, Layer.PRIMARY, 0, 0, 3)));
    }
}
