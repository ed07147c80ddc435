package org.abstractica.chess.engine.end;

import org.abstractica.chess.Color;
import org.abstractica.chess.EndReason;
import org.abstractica.chess.GameOutcome;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.abstractica.chess.engine.board.Board;
import org.abstractica.chess.engine.board.CompactBoard;
import org.abstractica.chess.engine.rules.GameState;
import org.abstractica.chess.engine.rules.MoveValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a game has ended.
 *
 * <p>Checks, in order, first match wins:</p>
 * <ol>
 *   <li>fifty-move rule (half-move clock reached {@value #FIFTY_MOVE_LIMIT})</li>
 *   <li>threefold repetition of the current placement in the history</li>
 *   <li>insufficient material (bare kings, or kings plus a single bishop or knight)</li>
 *   <li>any legal move for the side to move: game continues</li>
 *   <li>no legal move: checkmate if in check, stalemate otherwise</li>
 * </ol>
 *
 * <p>Must not be consulted while a promotion is pending.</p>
 */
public final class GameEndDetector
{
    private static final Logger LOG = LoggerFactory.getLogger(GameEndDetector.class);

    /**
     * Half-move clock value that ends the game in a draw.
     */
    public static final int FIFTY_MOVE_LIMIT = 50;

    /**
     * Number of occurrences of a placement that ends the game in a draw.
     */
    public static final int REPETITION_LIMIT = 3;

    private GameEndDetector()
    {
    }

    /**
     * Classifies the state.
     *
     * @param state   the game state after the latest completed move
     * @param history the positions reached so far, including the current one
     * @return the outcome, or empty if the game continues
     * @throws IllegalStateException if the side to move has no king
     */
    public static Optional<GameOutcome> detect(GameState state, MoveHistory history)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(history, "history");

        Optional<GameOutcome> outcome = classify(state, history);
        outcome.ifPresent(o -> LOG.debug("Game over: {} by {} in {}", o.result(), o.reason(), state));
        return outcome;
    }

    private static Optional<GameOutcome> classify(GameState state, MoveHistory history)
    {
        if (state.halfMoveClock() >= FIFTY_MOVE_LIMIT)
        {
            return Optional.of(GameOutcome.draw(EndReason.FIFTY_MOVE_RULE));
        }

        CompactBoard current = state.compactBoard();
        if (history.occurrences(current) >= REPETITION_LIMIT)
        {
            return Optional.of(GameOutcome.draw(EndReason.THREEFOLD_REPETITION));
        }

        Board board = state.board();
        if (isInsufficientMaterial(board))
        {
            return Optional.of(GameOutcome.draw(EndReason.INSUFFICIENT_MATERIAL));
        }

        Color toMove = state.turn();
        if (MoveValidator.hasAnyLegalMove(state))
        {
            return Optional.empty();
        }
        if (MoveValidator.isInCheck(state, toMove))
        {
            return Optional.of(GameOutcome.win(toMove.opposite(), EndReason.CHECKMATE));
        }
        return Optional.of(GameOutcome.draw(EndReason.STALEMATE));
    }

    /**
     * Only the two kings remain, or the two kings and one bishop or knight.
     */
    static boolean isInsufficientMaterial(Board board)
    {
        int count = board.pieceCount();
        if (count == 2)
        {
            return true;
        }
        if (count != 3)
        {
            return false;
        }
        for (int index = 0; index < 64; index++)
        {
            Optional<Piece> piece = board.get(Square.fromIndex(index));
            if (piece.isPresent() && piece.get().kind() != PieceKind.KING)
            {
                PieceKind kind = piece.get().kind();
                return kind == PieceKind.BISHOP || kind == PieceKind.KNIGHT;
            }
        }
        return false;
    }
}
