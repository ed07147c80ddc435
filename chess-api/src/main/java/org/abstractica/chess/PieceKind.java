package org.abstractica.chess;

/**
 * Kind of a chess piece.
 *
 * <p>Each kind carries a 3-bit code used by the compacted board encoding.
 * Code 0 is reserved for an empty square.</p>
 */
public enum PieceKind
{
    KING(1, 'k'),
    QUEEN(2, 'q'),
    ROOK(3, 'r'),
    KNIGHT(4, 'n'),
    BISHOP(5, 'b'),
    PAWN(6, 'p');

    private final int code;
    private final char letter;

    PieceKind(int code, char letter)
    {
        this.code = code;
        this.letter = letter;
    }

    /**
     * Returns the 3-bit code of this kind (1-6).
     *
     * @return the kind code
     */
    public int code()
    {
        return code;
    }

    /**
     * Returns the lowercase FEN letter of this kind.
     *
     * @return the FEN letter
     */
    public char letter()
    {
        return letter;
    }

    /**
     * Returns whether a pawn may promote to this kind.
     *
     * @return false for king and pawn
     */
    public boolean isPromotionTarget()
    {
        return this != KING && this != PAWN;
    }

    /**
     * Looks up a kind by its 3-bit code.
     *
     * @param code the code (1-6)
     * @return the kind
     * @throws IllegalArgumentException if no kind has the code
     */
    public static PieceKind fromCode(int code)
    {
        return switch (code)
        {
            case 1 -> KING;
            case 2 -> QUEEN;
            case 3 -> ROOK;
            case 4 -> KNIGHT;
            case 5 -> BISHOP;
            case 6 -> PAWN;
            default -> throw new IllegalArgumentException("Unknown piece code: " + code);
        };
    }

    /**
     * Looks up a kind by its FEN letter, in either case.
     *
     * @param letter the FEN letter
     * @return the kind
     * @throws IllegalArgumentException if no kind has the letter
     */
    public static PieceKind fromLetter(char letter)
    {
        char lower = Character.toLowerCase(letter);
        for (PieceKind kind : values())
        {
            if (kind.letter == lower)
            {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown piece letter: " + letter);
    }
}
