package org.abstractica.chess.protocol;

import org.abstractica.chess.ChessMove;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;

import java.util.Objects;

/**
 * Commands sent from client to server.
 */
public sealed interface ClientMessage permits
        ClientMessage.Move,
        ClientMessage.Promote,
        ClientMessage.RequestDraw,
        ClientMessage.Reconnect,
        ClientMessage.Resign
{
    /**
     * Player moves the piece on {@code from} to {@code to}.
     *
     * @param from source square
     * @param to   destination square
     */
    record Move(Square from, Square to) implements ClientMessage
    {
        public Move
        {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        public static Move of(String from, String to)
        {
            return new Move(Square.of(from), Square.of(to));
        }

        public ChessMove toChessMove()
        {
            return new ChessMove(from, to);
        }
    }

    /**
     * Player picks the piece their pawn promotes to.
     *
     * @param kind the chosen piece kind
     */
    record Promote(PieceKind kind) implements ClientMessage
    {
        public Promote
        {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * Player offers a draw, or accepts the opponent's offer.
     */
    record RequestDraw() implements ClientMessage
    {
    }

    /**
     * Player asks for the full game state after reconnecting.
     */
    record Reconnect() implements ClientMessage
    {
    }

    /**
     * Player resigns the game.
     */
    record Resign() implements ClientMessage
    {
    }
}
