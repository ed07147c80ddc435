package org.abstractica.chess.engine.board;

import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Board}.
 */
class BoardTest
{
    private Board board;

    @BeforeEach
    void setUp()
    {
        board = Board.standard();
    }

    @Test
    void standard_hasThirtyTwoPieces()
    {
        assertEquals(32, board.pieceCount());
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.KING)), board.get(Square.of("e1")));
        assertEquals(Optional.of(Piece.of(Color.BLACK, PieceKind.QUEEN)), board.get(Square.of("d8")));
        assertEquals(Optional.of(Piece.of(Color.BLACK, PieceKind.PAWN)), board.get(Square.of("h7")));
        assertTrue(board.isEmpty(Square.of("e4")));
    }

    @Test
    void findKing_locatesBothKings()
    {
        assertEquals(Optional.of(Square.of("e1")), board.findKing(Color.WHITE));
        assertEquals(Optional.of(Square.of("e8")), board.findKing(Color.BLACK));
        assertTrue(Board.empty().findKing(Color.WHITE).isEmpty());
    }

    @Test
    void relocate_overwritesDestination()
    {
        board.relocate(Square.of("d1"), Square.of("d7"));

        assertTrue(board.isEmpty(Square.of("d1")));
        assertTrue(board.isOccupiedBy(Square.of("d7"), Color.WHITE));
        assertEquals(31, board.pieceCount());
    }

    @Test
    void relocate_fromEmptySquare_doesNothing()
    {
        board.relocate(Square.of("e4"), Square.of("e2"));
        assertEquals(Board.standard(), board);
    }

    @Test
    void remove_returnsRemovedPiece()
    {
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.KNIGHT)), board.remove(Square.of("g1")));
        assertTrue(board.remove(Square.of("g1")).isEmpty());
    }

    @Test
    void copy_isIndependent()
    {
        Board copy = board.copy();
        copy.remove(Square.of("a1"));

        assertNotEquals(board, copy);
        assertTrue(board.isOccupiedBy(Square.of("a1"), Color.WHITE));
    }
}
