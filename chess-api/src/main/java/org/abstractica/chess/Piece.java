package org.abstractica.chess;

import java.util.Objects;

/**
 * A chess piece.
 *
 * @param color the side owning the piece
 * @param kind  the kind of piece
 */
public record Piece(Color color, PieceKind kind)
{
    public Piece
    {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates a piece.
     *
     * @param color the side owning the piece
     * @param kind  the kind of piece
     * @return the piece
     */
    public static Piece of(Color color, PieceKind kind)
    {
        return new Piece(color, kind);
    }

    /**
     * Parses a FEN piece letter; uppercase is white, lowercase is black.
     *
     * @param letter the FEN letter
     * @return the piece
     */
    public static Piece fromFen(char letter)
    {
        Color color = Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK;
        return new Piece(color, PieceKind.fromLetter(letter));
    }

    /**
     * Returns the FEN letter of this piece.
     *
     * @return uppercase for white, lowercase for black
     */
    public char toFen()
    {
        return color == Color.WHITE ? Character.toUpperCase(kind.letter()) : kind.letter();
    }

    public boolean is(Color color, PieceKind kind)
    {
        return this.color == color && this.kind == kind;
    }
}
