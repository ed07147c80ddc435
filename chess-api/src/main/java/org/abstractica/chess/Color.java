package org.abstractica.chess;

/**
 * Side of a chess game.
 */
public enum Color
{
    WHITE,
    BLACK;

    /**
     * Returns the other side.
     *
     * @return the opposing color
     */
    public Color opposite()
    {
        return this == WHITE ? BLACK : WHITE;
    }

    /**
     * Returns the direction pawns of this color advance in, as a rank delta.
     *
     * @return +1 for white, -1 for black
     */
    public int forward()
    {
        return this == WHITE ? 1 : -1;
    }

    /**
     * Returns the rank (0-7) this color's pieces start on.
     *
     * @return 0 for white, 7 for black
     */
    public int homeRank()
    {
        return this == WHITE ? 0 : 7;
    }
}
