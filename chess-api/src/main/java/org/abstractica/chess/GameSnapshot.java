package org.abstractica.chess;

import java.util.Objects;

/**
 * Serializable snapshot of a game's full state.
 *
 * <p>The FEN string carries piece placement, side to move, castling
 * availability, en-passant target, half-move clock and full-move number.
 * FEN has no field for a pending promotion, so it travels alongside.</p>
 *
 * @param fen              the position in Forsyth-Edwards Notation
 * @param promotionPending whether a pawn is waiting for its promotion choice
 */
public record GameSnapshot(String fen, boolean promotionPending)
{
    public GameSnapshot
    {
        Objects.requireNonNull(fen, "fen");
    }
}
