package org.abstractica.chess;

import java.util.Objects;

/**
 * A move request: relocate whatever stands on {@code from} to {@code to}.
 *
 * <p>Castling is expressed as the king's two-file move; promotion is
 * requested separately once the pawn has arrived.</p>
 *
 * @param from source square
 * @param to   destination square
 */
public record ChessMove(Square from, Square to)
{
    public ChessMove
    {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    /**
     * Parses long algebraic notation such as {@code "e2e4"}.
     *
     * @param text the move text
     * @return the move
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ChessMove parse(String text)
    {
        Objects.requireNonNull(text, "text");
        if (text.length() != 4)
        {
            throw new IllegalArgumentException("Invalid move: " + text);
        }
        return new ChessMove(Square.of(text.substring(0, 2)), Square.of(text.substring(2, 4)));
    }

    public int rankDelta()
    {
        return to.rank() - from.rank();
    }

    public int fileDelta()
    {
        return to.file() - from.file();
    }

    @Override
    public String toString()
    {
        return from.toString() + to;
    }
}
