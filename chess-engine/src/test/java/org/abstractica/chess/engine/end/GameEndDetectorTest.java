package org.abstractica.chess.engine.end;

import org.abstractica.chess.ChessMove;
import org.abstractica.chess.Color;
import org.abstractica.chess.EndReason;
import org.abstractica.chess.GameOutcome;
import org.abstractica.chess.engine.rules.Fen;
import org.abstractica.chess.engine.rules.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GameEndDetector} and {@link MoveHistory}.
 */
class GameEndDetectorTest
{
    private MoveHistory history;

    @BeforeEach
    void setUp()
    {
        history = new MoveHistory();
    }

    private Optional<GameOutcome> play(GameState state, String... moves)
    {
        Optional<GameOutcome> outcome = Optional.empty();
        for (String move : moves)
        {
            assertTrue(outcome.isEmpty(), "game already over before " + move);
            state.applyMove(ChessMove.parse(move));
            history.record(state.compactBoard());
            outcome = GameEndDetector.detect(state, history);
        }
        return outcome;
    }

    @Test
    void startingPosition_continues()
    {
        assertTrue(GameEndDetector.detect(GameState.standard(), history).isEmpty());
    }

    @Test
    void foolsMate_blackWinsByCheckmate()
    {
        Optional<GameOutcome> outcome = play(GameState.standard(), "f2f3", "e7e5", "g2g4", "d8h4");
        assertEquals(Optional.of(GameOutcome.win(Color.BLACK, EndReason.CHECKMATE)), outcome);
    }

    @Test
    void rookMate_whiteWinsByCheckmate()
    {
        GameState state = Fen.parse("k7/2K5/8/8/8/8/8/R7 b - - 0 1");
        assertEquals(Optional.of(GameOutcome.win(Color.WHITE, EndReason.CHECKMATE)),
                GameEndDetector.detect(state, history));
    }

    @Test
    void kingAndRookVersusKing_stalemate()
    {
        GameState state = Fen.parse("k7/1R6/2K5/8/8/8/8/8 b - - 0 1");
        assertEquals(Optional.of(GameOutcome.draw(EndReason.STALEMATE)), GameEndDetector.detect(state, history));
    }

    @Test
    void stalemate_reachedByMove()
    {
        GameState state = Fen.parse("k7/8/2K5/1R6/8/8/8/8 w - - 0 1");
        assertEquals(Optional.of(GameOutcome.draw(EndReason.STALEMATE)), play(state, "b5b7"));
    }

    @Test
    void insufficientMaterial_minorPieceOrBareKings()
    {
        assertEquals(Optional.of(GameOutcome.draw(EndReason.INSUFFICIENT_MATERIAL)),
                GameEndDetector.detect(Fen.parse("k7/8/8/8/8/8/8/K6B w - - 0 1"), history));
        assertEquals(Optional.of(GameOutcome.draw(EndReason.INSUFFICIENT_MATERIAL)),
                GameEndDetector.detect(Fen.parse("k7/8/8/8/8/8/8/K5n1 w - - 0 1"), history));
        assertEquals(Optional.of(GameOutcome.draw(EndReason.INSUFFICIENT_MATERIAL)),
                GameEndDetector.detect(Fen.parse("k7/8/8/8/8/8/8/K7 w - - 0 1"), history));
    }

    @Test
    void isInsufficientMaterial_onlyForLoneMinorPiece()
    {
        assertTrue(GameEndDetector.isInsufficientMaterial(Fen.parse("k7/8/8/8/8/8/8/K6B w - -").board()));
        assertFalse(GameEndDetector.isInsufficientMaterial(Fen.parse("k7/8/8/8/8/8/8/K6R w - -").board()));
        assertFalse(GameEndDetector.isInsufficientMaterial(Fen.parse("k7/8/8/8/8/8/8/K5BN w - -").board()));
        assertFalse(GameEndDetector.isInsufficientMaterial(Fen.parse("k7/8/8/8/8/8/P7/K7 w - -").board()));
    }

    @Test
    void fiftyMoveRule_atFiftyPlies()
    {
        GameState state = Fen.parse("k7/8/8/8/8/8/8/K6R w - - 48 80");

        assertTrue(play(state, "h1h2").isEmpty());
        assertEquals(49, state.halfMoveClock());

        assertEquals(Optional.of(GameOutcome.draw(EndReason.FIFTY_MOVE_RULE)), play(state, "a8b8"));
    }

    @Test
    void fiftyMoveRule_takesPriorityOverCheckmate()
    {
        GameState state = Fen.parse("k7/2K5/8/8/8/8/8/R7 b - - 50 90");
        assertEquals(Optional.of(GameOutcome.draw(EndReason.FIFTY_MOVE_RULE)), GameEndDetector.detect(state, history));
    }

    @Test
    void threefoldRepetition_onThirdOccurrence()
    {
        GameState state = GameState.standard();
        String[] cycle = {"g1f3", "g8f6", "f3g1", "f6g8"};

        assertTrue(play(state, cycle).isEmpty());
        assertTrue(play(state, cycle).isEmpty());
        assertEquals(2, history.occurrences(GameState.standard().compactBoard()));

        assertEquals(Optional.of(GameOutcome.draw(EndReason.THREEFOLD_REPETITION)), play(state, "g1f3"));
        assertEquals(9, history.size());
    }

    @Test
    void moveHistory_countsBitIdenticalPositions()
    {
        history.record(GameState.standard().compactBoard());
        history.record(Fen.parse("k7/8/8/8/8/8/8/K7 w - -").compactBoard());
        history.record(Fen.parse(Fen.STARTING_POSITION).compactBoard());

        assertEquals(3, history.size());
        assertEquals(2, history.occurrences(GameState.standard().compactBoard()));
        assertThrows(UnsupportedOperationException.class, () -> history.positions().clear());
    }

    @Test
    void detect_withoutKingToMove_throws()
    {
        GameState state = Fen.parse("k7/8/8/8/8/8/8/R6R w - - 0 1");
        assertThrows(IllegalStateException.class, () -> GameEndDetector.detect(state, history));
    }
}
