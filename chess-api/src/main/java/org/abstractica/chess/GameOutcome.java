package org.abstractica.chess;

import java.util.Objects;

/**
 * The terminal result of a game together with the reason it ended.
 *
 * @param result who won, or draw
 * @param reason why the game ended
 */
public record GameOutcome(GameResult result, EndReason reason)
{
    public GameOutcome
    {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(reason, "reason");
    }

    public static GameOutcome win(Color winner, EndReason reason)
    {
        return new GameOutcome(GameResult.winFor(winner), reason);
    }

    public static GameOutcome draw(EndReason reason)
    {
        return new GameOutcome(GameResult.DRAW, reason);
    }
}
