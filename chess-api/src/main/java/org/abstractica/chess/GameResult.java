package org.abstractica.chess;

/**
 * Final result of a game.
 */
public enum GameResult
{
    WHITE_WINS,
    BLACK_WINS,
    DRAW;

    /**
     * Returns the result crediting the given side with a win.
     *
     * @param winner the winning side
     * @return WHITE_WINS or BLACK_WINS
     */
    public static GameResult winFor(Color winner)
    {
        return winner == Color.WHITE ? WHITE_WINS : BLACK_WINS;
    }
}
