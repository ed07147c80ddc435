package org.abstractica.chess;

import java.util.Objects;

/**
 * A square on the board.
 *
 * <p>Ranks and files are numbered 0-7; rank 0 is White's back rank and
 * file 0 is the a-file.</p>
 *
 * @param rank the rank (0-7)
 * @param file the file (0-7)
 */
public record Square(int rank, int file)
{
    private static final Square[] SQUARES = new Square[64];

    static
    {
        for (int i = 0; i < 64; i++)
        {
            SQUARES[i] = new Square(i / 8, i % 8);
        }
    }

    public Square
    {
        if (rank < 0 || rank > 7)
        {
            throw new IllegalArgumentException("Rank must be 0-7: " + rank);
        }
        if (file < 0 || file > 7)
        {
            throw new IllegalArgumentException("File must be 0-7: " + file);
        }
    }

    /**
     * Returns the square at the given rank and file.
     *
     * @param rank the rank (0-7)
     * @param file the file (0-7)
     * @return the square
     * @throws IllegalArgumentException if either value is out of range
     */
    public static Square of(int rank, int file)
    {
        if (rank < 0 || rank > 7 || file < 0 || file > 7)
        {
            throw new IllegalArgumentException("Square out of range: rank=" + rank + ", file=" + file);
        }
        return SQUARES[rank * 8 + file];
    }

    /**
     * Returns the square for a raw index; values wrap modulo 64.
     *
     * @param index the square index, rank * 8 + file
     * @return the square
     */
    public static Square fromIndex(int index)
    {
        return SQUARES[Math.floorMod(index, 64)];
    }

    /**
     * Parses algebraic notation such as {@code "e4"}.
     *
     * @param name the square name
     * @return the square
     * @throws IllegalArgumentException if the name is malformed
     */
    public static Square of(String name)
    {
        Objects.requireNonNull(name, "name");
        if (name.length() != 2)
        {
            throw new IllegalArgumentException("Invalid square: " + name);
        }
        int file = Character.toLowerCase(name.charAt(0)) - 'a';
        int rank = name.charAt(1) - '1';
        if (file < 0 || file > 7 || rank < 0 || rank > 7)
        {
            throw new IllegalArgumentException("Invalid square: " + name);
        }
        return SQUARES[rank * 8 + file];
    }

    /**
     * Returns whether the given coordinates lie on the board.
     */
    public static boolean isValid(int rank, int file)
    {
        return rank >= 0 && rank < 8 && file >= 0 && file < 8;
    }

    /**
     * Returns the index of this square, rank * 8 + file.
     *
     * @return index in 0-63
     */
    public int index()
    {
        return rank * 8 + file;
    }

    /**
     * Returns the square offset from this one, or null if it falls off the board.
     *
     * @param rankDelta ranks to move
     * @param fileDelta files to move
     * @return the offset square, or null
     */
    public Square offset(int rankDelta, int fileDelta)
    {
        int r = rank + rankDelta;
        int f = file + fileDelta;
        return isValid(r, f) ? SQUARES[r * 8 + f] : null;
    }

    @Override
    public String toString()
    {
        return "" + (char) ('a' + file) + (char) ('1' + rank);
    }
}
