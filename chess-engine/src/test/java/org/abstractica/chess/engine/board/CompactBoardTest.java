package org.abstractica.chess.engine.board;

import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CompactBoard}.
 */
class CompactBoardTest
{
    @Test
    void toBytes_isThirtyTwoBytes()
    {
        assertEquals(CompactBoard.BYTES, Board.standard().compact().toBytes().length);
        assertEquals(32, CompactBoard.BYTES);
    }

    @Test
    void toBytes_packsFourBitsPerSquare()
    {
        byte[] bytes = Board.standard().compact().toBytes();

        // a1 white rook (3) in the low nibble, b1 white knight (4) in the high nibble
        assertEquals((byte) 0x43, bytes[7]);
        // g8 black knight (8|4) low, h8 black rook (8|3) high
        assertEquals((byte) 0xBC, bytes[24]);
        // ranks 3-6 are empty
        for (int i = 8; i < 24; i++)
        {
            assertEquals(0, bytes[i], "byte " + i);
        }
    }

    @Test
    void fromBytes_restoresBoard()
    {
        Board board = Board.standard();
        board.relocate(Square.of("e2"), Square.of("e4"));
        CompactBoard compact = board.compact();

        CompactBoard decoded = CompactBoard.fromBytes(compact.toBytes());

        assertEquals(compact, decoded);
        assertEquals(board, decoded.toBoard());
    }

    @Test
    void fromBytes_rejectsWrongLength()
    {
        assertThrows(IllegalArgumentException.class, () -> CompactBoard.fromBytes(new byte[31]));
    }

    @Test
    void fromBytes_rejectsInvalidCodes()
    {
        byte[] kindSeven = new byte[32];
        kindSeven[0] = 0x07;
        assertThrows(IllegalArgumentException.class, () -> CompactBoard.fromBytes(kindSeven));

        byte[] colorWithoutKind = new byte[32];
        colorWithoutKind[31] = 0x08;
        assertThrows(IllegalArgumentException.class, () -> CompactBoard.fromBytes(colorWithoutKind));
    }

    @Test
    void equality_dependsOnlyOnPlacement()
    {
        Board a = Board.empty();
        a.set(Square.of("c3"), Piece.of(Color.BLACK, PieceKind.BISHOP));
        Board b = Board.empty();
        b.set(Square.of("c3"), Piece.of(Color.BLACK, PieceKind.BISHOP));
        Board c = Board.empty();
        c.set(Square.of("c3"), Piece.of(Color.WHITE, PieceKind.BISHOP));

        assertEquals(a.compact(), b.compact());
        assertEquals(a.compact().hashCode(), b.compact().hashCode());
        assertNotEquals(a.compact(), c.compact());
        assertEquals(Board.empty().compact(), CompactBoard.fromBytes(new byte[32]));
    }
}
