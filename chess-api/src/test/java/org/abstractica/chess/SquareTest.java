package org.abstractica.chess;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Square} and {@link ChessMove}.
 */
class SquareTest
{
    @Test
    void of_parsesAlgebraicName()
    {
        Square e4 = Square.of("e4");
        assertEquals(3, e4.rank());
        assertEquals(4, e4.file());
        assertEquals("e4", e4.toString());
    }

    @Test
    void of_returnsCachedInstance()
    {
        assertSame(Square.of(0, 0), Square.of("a1"));
        assertSame(Square.of(7, 7), Square.fromIndex(63));
    }

    @Test
    void of_rejectsMalformedNames()
    {
        assertThrows(IllegalArgumentException.class, () -> Square.of("i1"));
        assertThrows(IllegalArgumentException.class, () -> Square.of("a9"));
        assertThrows(IllegalArgumentException.class, () -> Square.of("e"));
        assertThrows(IllegalArgumentException.class, () -> Square.of(8, 0));
        assertThrows(IllegalArgumentException.class, () -> new Square(0, -1));
    }

    @Test
    void fromIndex_wrapsModulo64()
    {
        assertEquals(Square.of("a1"), Square.fromIndex(64));
        assertEquals(Square.of("h8"), Square.fromIndex(-1));
        assertEquals(12, Square.of("e2").index());
    }

    @Test
    void offset_returnsNullOffBoard()
    {
        assertEquals(Square.of("f6"), Square.of("e4").offset(2, 1));
        assertNull(Square.of("h8").offset(1, 0));
        assertNull(Square.of("a1").offset(0, -1));
    }

    @Test
    void chessMove_parseAndDeltas()
    {
        ChessMove move = ChessMove.parse("g1f3");
        assertEquals(Square.of("g1"), move.from());
        assertEquals(Square.of("f3"), move.to());
        assertEquals(2, move.rankDelta());
        assertEquals(-1, move.fileDelta());
        assertEquals("g1f3", move.toString());
        assertThrows(IllegalArgumentException.class, () -> ChessMove.parse("g1f"));
    }
}
