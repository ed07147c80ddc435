package org.abstractica.chess.engine.rules;

import org.abstractica.chess.ChessMove;
import org.abstractica.chess.Color;
import org.abstractica.chess.GameSnapshot;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.abstractica.chess.engine.board.Board;
import org.abstractica.chess.engine.board.CompactBoard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GameState}.
 */
class GameStateTest
{
    private GameState state;

    @BeforeEach
    void setUp()
    {
        state = GameState.standard();
    }

    private void play(String... moves)
    {
        for (String move : moves)
        {
            state.applyMove(ChessMove.parse(move));
        }
    }

    @Test
    void applyMove_updatesTurnClocksAndEnPassant()
    {
        assertFalse(state.applyMove(ChessMove.parse("e2e4")));

        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.PAWN)), state.pieceAt(Square.of("e4")));
        assertEquals(Color.BLACK, state.turn());
        assertEquals(Optional.of(4), state.enPassantFile());
        assertEquals(0, state.halfMoveClock());
        assertEquals(1, state.fullMoveNumber());

        play("g8f6");
        assertEquals(Color.WHITE, state.turn());
        assertTrue(state.enPassantFile().isEmpty());
        assertEquals(1, state.halfMoveClock());
        assertEquals(2, state.fullMoveNumber());
    }

    @Test
    void applyMove_captureResetsClock()
    {
        state = Fen.parse("4k3/8/8/8/8/2p5/8/1N2K3 w - - 10 30");
        play("b1c3");
        assertEquals(0, state.halfMoveClock());
        assertEquals(3, state.board().pieceCount());
    }

    @Test
    void rejectedMove_leavesStateUntouched()
    {
        play("e2e4", "e7e5");
        GameState before = state.copy();
        CompactBoard compactBefore = state.compactBoard();

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> state.applyMove(ChessMove.parse("e4e5")));

        assertEquals(ChessMove.parse("e4e5"), e.getMove());
        assertEquals(before, state);
        assertEquals(compactBefore, state.compactBoard());
        assertEquals(before.castlingRights(), state.castlingRights());
        assertEquals(before.enPassantFile(), state.enPassantFile());
    }

    @Test
    void rejectedMove_wrongSide()
    {
        GameState before = state.copy();
        assertThrows(InvalidMoveException.class, () -> state.applyMove(ChessMove.parse("e7e5")));
        assertEquals(before, state);
    }

    @Test
    void manualUndo_restoresBoardButNotFlags()
    {
        play("e2e4");

        Board undone = state.board();
        undone.relocate(Square.of("e4"), Square.of("e2"));

        assertEquals(Board.standard(), undone);
        assertNotEquals(GameState.standard(), state);
        assertEquals(Color.BLACK, state.turn());
        assertEquals(Optional.of(4), state.enPassantFile());
    }

    @Test
    void board_returnsCopy()
    {
        state.board().remove(Square.of("e1"));
        assertTrue(state.pieceAt(Square.of("e1")).isPresent());
    }

    @Test
    void castling_movesRookAndClearsRights()
    {
        state = Fen.parse("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        assertTrue(state.applyMove(ChessMove.parse("e1g1")));

        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.KING)), state.pieceAt(Square.of("g1")));
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.ROOK)), state.pieceAt(Square.of("f1")));
        assertTrue(state.pieceAt(Square.of("h1")).isEmpty());
        assertFalse(state.castlingRights().canCastle(Color.WHITE, CastlingSide.KING_SIDE));
        assertFalse(state.castlingRights().canCastle(Color.WHITE, CastlingSide.QUEEN_SIDE));
        assertTrue(state.castlingRights().canCastle(Color.BLACK, CastlingSide.QUEEN_SIDE));

        assertTrue(state.applyMove(ChessMove.parse("e8c8")));
        assertEquals(Optional.of(Piece.of(Color.BLACK, PieceKind.ROOK)), state.pieceAt(Square.of("d8")));
        assertTrue(state.pieceAt(Square.of("a8")).isEmpty());
    }

    @Test
    void enPassant_removesCapturedPawn()
    {
        play("e2e4", "a7a6", "e4e5", "d7d5");

        assertTrue(state.applyMove(ChessMove.parse("e5d6")));

        assertTrue(state.pieceAt(Square.of("d5")).isEmpty());
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.PAWN)), state.pieceAt(Square.of("d6")));
        assertEquals(0, state.halfMoveClock());
    }

    // ========== Promotion ==========

    @Test
    void promotion_suspendsPlayUntilResolved()
    {
        state = Fen.parse("8/P6k/8/8/8/8/8/K7 w - - 3 40");

        state.applyMove(ChessMove.parse("a7a8"));

        assertTrue(state.isPromotionPending());
        assertEquals(Optional.of(Square.of("a8")), state.promotionSquare());
        assertEquals(Optional.of(Color.WHITE), state.promotingColor());
        assertEquals(Color.BLACK, state.turn());
        assertThrows(InvalidMoveException.class, () -> state.applyMove(ChessMove.parse("h7h6")));
        assertTrue(state.snapshot().promotionPending());
    }

    @Test
    void promotion_replacesPawnWithoutFlippingTurn()
    {
        state = Fen.parse("8/P6k/8/8/8/8/8/K7 w - - 3 40");
        play("a7a8");

        assertThrows(InvalidPromotionException.class, () -> state.promote(PieceKind.KING));
        assertThrows(InvalidPromotionException.class, () -> state.promote(PieceKind.PAWN));
        assertTrue(state.isPromotionPending());

        state.promote(PieceKind.KNIGHT);

        assertFalse(state.isPromotionPending());
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.KNIGHT)), state.pieceAt(Square.of("a8")));
        assertEquals(Color.BLACK, state.turn());
        assertThrows(InvalidPromotionException.class, () -> state.promote(PieceKind.QUEEN));

        play("h7h6");
        assertEquals(Color.WHITE, state.turn());
    }

    @Test
    void promotion_byCapture()
    {
        state = Fen.parse("1r5k/P7/8/8/8/8/8/K7 w - - 0 1");
        play("a7b8");
        state.promote(PieceKind.QUEEN);
        assertEquals(Optional.of(Piece.of(Color.WHITE, PieceKind.QUEEN)), state.pieceAt(Square.of("b8")));
        assertEquals(3, state.board().pieceCount());
    }

    @Test
    void snapshot_carriesFen()
    {
        GameSnapshot snapshot = state.snapshot();
        assertEquals(Fen.STARTING_POSITION, snapshot.fen());
        assertFalse(snapshot.promotionPending());
    }

    @Test
    void copy_isIndependent()
    {
        GameState copy = state.copy();
        copy.applyMove(ChessMove.parse("d2d4"));

        assertEquals(GameState.standard(), state);
        assertNotEquals(state, copy);
    }
}
