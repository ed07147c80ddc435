package org.abstractica.chess.engine.rules;

import org.abstractica.chess.ChessMove;

/**
 * Thrown when a move fails the legality rules or the state does not accept
 * moves (a promotion is pending).
 *
 * <p>Always recoverable: the state is left untouched.</p>
 */
public class InvalidMoveException extends RuntimeException
{
    private final transient ChessMove move;

    public InvalidMoveException(ChessMove move, String message)
    {
        super(message + ": " + move);
        this.move = move;
    }

    /**
     * Returns the rejected move.
     */
    public ChessMove getMove()
    {
        return move;
    }
}
