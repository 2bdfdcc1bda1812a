package com.wataruto.engine.game.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoardTest {

    @Nested
    @DisplayName("cells")
    class CellTests {

        @Test
        void newBoardIsEmpty() {
            Board b = new Board(4);

            for (int r = 0; r < 4; r++) {
                for (int c = 0; c < 4; c++) {
                    assertTrue(b.isEmpty(r, c));
                    assertNull(b.primary(r, c));
                    assertNull(b.secondary(r, c));
                }
            }
        }

        @Test
        void layersAreIndependent() {
            Board b = new Board(4);
            b.place(1, 2, Layer.PRIMARY, Player.A);

            assertEquals(Player.A, b.primary(1, 2));
            assertNull(b.secondary(1, 2));
            assertFalse(b.isEmpty(1, 2));
            assertTrue(b.isEmpty(1, 2, Layer.SECONDARY));
        }

        @Test
        void cellBelongsToPlayerOnEitherLayer() {
            Board b = new Board(4);
            b.place(0, 0, Layer.PRIMARY, Player.A);
            b.place(0, 1, Layer.SECONDARY, Player.A);
            b.place(0, 2, Layer.PRIMARY, Player.B);

            assertTrue(b.belongsTo(0, 0, Player.A));
            assertTrue(b.belongsTo(0, 1, Player.A));
            assertFalse(b.belongsTo(0, 2, Player.A));
            assertTrue(b.belongsTo(0, 2, Player.B));
        }

        @Test
        void offBoardBelongsToNobody() {
            Board b = new Board(4);

            assertFalse(b.belongsTo(-1, 0, Player.A));
            assertFalse(b.belongsTo(0, 4, Player.B));
            assertFalse(b.isEmpty(4, 4));
        }

        @Test
        void offBoardReadOrWriteIsRefused() {
            Board b = new Board(4);

            assertThrows(IllegalArgumentException.class, () -> b.get(4, 0, Layer.PRIMARY));
            assertThrows(IllegalArgumentException.class, () -> b.place(0, -1, Layer.PRIMARY, Player.A));
        }

        @Test
        void clearEmptiesOneLayer() {
            Board b = new Board(3);
            b.place(2, 2, Layer.PRIMARY, Player.B);
            b.place(2, 2, Layer.SECONDARY, Player.B);

            b.clear(2, 2, Layer.SECONDARY);

            assertEquals(Player.B, b.primary(2, 2));
            assertNull(b.secondary(2, 2));
        }
    }

    @Nested
    @DisplayName("copy and view")
    class CopyTests {

        @Test
        void copySharesNothing() {
            Board b = new Board(3);
            b.place(1, 1, Layer.PRIMARY, Player.A);

            Board copy = b.copy();
            copy.place(0, 0, Layer.PRIMARY, Player.B);
            copy.clear(1, 1, Layer.PRIMARY);

            assertTrue(b.isEmpty(0, 0));
            assertEquals(Player.A, b.primary(1, 1));
        }

        @Test
        void viewRoundTrips() {
            Board b = new Board(3);
            b.place(0, 1, Layer.PRIMARY, Player.A);
            b.place(0, 1, Layer.SECONDARY, Player.A);
            b.place(2, 0, Layer.PRIMARY, Player.B);

            Board back = Board.fromView(b.view());

            assertTrue(back.sameContent(b));
        }

        @Test
        void viewIsDetached() {
            Board b = new Board(3);
            Player[][][] view = b.view();
            view[0][0][0] = Player.A;

            assertTrue(b.isEmpty(0, 0));
        }

        @Test
        void fromViewRejectsRaggedRows() {
            Player[][][] ragged = new Player[3][][];
            ragged[0] = new Player[3][2];
            ragged[1] = new Player[2][2];
            ragged[2] = new Player[3][2];

            assertThrows(IllegalArgumentException.class, () -> Board.fromView(ragged));
        }

        @Test
        void fromViewRejectsMissingRow() {
            Player[][][] view = new Board(3).view();
            view[1] = null;

            assertThrows(IllegalArgumentException.class, () -> Board.fromView(view));
        }

        @Test
        void countsStonesPerLayer() {
            Board b = new Board(3);
            b.place(0, 0, Layer.PRIMARY, Player.A);
            b.place(0, 1, Layer.PRIMARY, Player.A);
            b.place(0, 1, Layer.SECONDARY, Player.A);
            b.place(2, 2, Layer.PRIMARY, Player.B);

            assertArrayEquals(new int[]{2, 1}, b.countStones(Player.A));
            assertArrayEquals(new int[]{1, 0}, b.countStones(Player.B));
        }
    }
}
