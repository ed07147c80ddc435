package org.abstractica.chess;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PieceKind}, {@link Piece} and {@link Color}.
 */
class PieceTest
{
    @Test
    void pieceKind_codesAreStable()
    {
        assertEquals(1, PieceKind.KING.code());
        assertEquals(6, PieceKind.PAWN.code());
        for (PieceKind kind : PieceKind.values())
        {
            assertEquals(kind, PieceKind.fromCode(kind.code()));
        }
        assertThrows(IllegalArgumentException.class, () -> PieceKind.fromCode(0));
        assertThrows(IllegalArgumentException.class, () -> PieceKind.fromCode(7));
    }

    @Test
    void pieceKind_promotionTargets()
    {
        assertTrue(PieceKind.QUEEN.isPromotionTarget());
        assertTrue(PieceKind.KNIGHT.isPromotionTarget());
        assertFalse(PieceKind.KING.isPromotionTarget());
        assertFalse(PieceKind.PAWN.isPromotionTarget());
    }

    @Test
    void piece_fenLetterCarriesColor()
    {
        assertEquals(Piece.of(Color.WHITE, PieceKind.KNIGHT), Piece.fromFen('N'));
        assertEquals(Piece.of(Color.BLACK, PieceKind.QUEEN), Piece.fromFen('q'));
        assertEquals('R', Piece.of(Color.WHITE, PieceKind.ROOK).toFen());
        assertEquals('p', Piece.of(Color.BLACK, PieceKind.PAWN).toFen());
        assertThrows(IllegalArgumentException.class, () -> Piece.fromFen('x'));
    }

    @Test
    void color_directions()
    {
        assertEquals(Color.BLACK, Color.WHITE.opposite());
        assertEquals(1, Color.WHITE.forward());
        assertEquals(-1, Color.BLACK.forward());
        assertEquals(0, Color.WHITE.homeRank());
        assertEquals(7, Color.BLACK.homeRank());
    }

    @Test
    void gameOutcome_winMapsToResult()
    {
        GameOutcome outcome = GameOutcome.win(Color.BLACK, EndReason.CHECKMATE);
        assertEquals(GameResult.BLACK_WINS, outcome.result());
        assertEquals(EndReason.CHECKMATE, outcome.reason());
        assertEquals(GameResult.DRAW, GameOutcome.draw(EndReason.STALEMATE).result());
    }
}
