package org.abstractica.chess.protocol;

import org.abstractica.chess.Color;
import org.abstractica.chess.EndReason;
import org.abstractica.chess.GameOutcome;
import org.abstractica.chess.GameResult;
import org.abstractica.chess.GameSnapshot;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;

import java.util.Objects;

/**
 * Notifications sent from server to client.
 */
public sealed interface ServerMessage permits
        ServerMessage.MatchFound,
        ServerMessage.MoveApplied,
        ServerMessage.PromotionApplied,
        ServerMessage.StateSnapshot,
        ServerMessage.DrawOffered,
        ServerMessage.GameEnded
{
    /**
     * The client was paired with an opponent.
     *
     * @param color the side the client plays
     */
    record MatchFound(Color color) implements ServerMessage
    {
        public MatchFound
        {
            Objects.requireNonNull(color, "color");
        }
    }

    /**
     * The opponent made a move.
     *
     * @param from source square
     * @param to   destination square
     */
    record MoveApplied(Square from, Square to) implements ServerMessage
    {
        public MoveApplied
        {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /**
     * The opponent promoted a pawn.
     *
     * @param kind the piece the pawn became
     */
    record PromotionApplied(PieceKind kind) implements ServerMessage
    {
        public PromotionApplied
        {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * Full game state.
     *
     * <p>Sent in reply to a rejected command (the client infers rejection
     * from the unchanged state) and in reply to a reconnect.</p>
     *
     * @param snapshot the current state
     */
    record StateSnapshot(GameSnapshot snapshot) implements ServerMessage
    {
        public StateSnapshot
        {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    /**
     * The opponent offers a draw.
     */
    record DrawOffered() implements ServerMessage
    {
    }

    /**
     * The game is over.
     *
     * @param result who won, or draw
     * @param reason why the game ended
     */
    record GameEnded(GameResult result, EndReason reason) implements ServerMessage
    {
        public GameEnded
        {
            Objects.requireNonNull(result, "result");
            Objects.requireNonNull(reason, "reason");
        }

        public static GameEnded of(GameOutcome outcome)
        {
            return new GameEnded(outcome.result(), outcome.reason());
        }
    }
}
