package org.abstractica.chess.engine.rules;

/**
 * The two directions a king can castle in, with the files involved.
 */
public enum CastlingSide
{
    KING_SIDE(7, 6, 5),
    QUEEN_SIDE(0, 2, 3);

    /**
     * File the king starts on for either side.
     */
    public static final int KING_FILE = 4;

    private final int rookFile;
    private final int kingTargetFile;
    private final int rookTargetFile;

    CastlingSide(int rookFile, int kingTargetFile, int rookTargetFile)
    {
        this.rookFile = rookFile;
        this.kingTargetFile = kingTargetFile;
        this.rookTargetFile = rookTargetFile;
    }

    public int rookFile()
    {
        return rookFile;
    }

    public int kingTargetFile()
    {
        return kingTargetFile;
    }

    public int rookTargetFile()
    {
        return rookTargetFile;
    }

    /**
     * Returns the file step from the king towards the rook.
     */
    public int step()
    {
        return this == KING_SIDE ? 1 : -1;
    }

    /**
     * Returns the side a king move to the given file castles towards.
     *
     * @param kingTargetFile destination file of the king
     * @return the side, or null if the file is not a castling destination
     */
    public static CastlingSide forKingTarget(int kingTargetFile)
    {
        if (kingTargetFile == KING_SIDE.kingTargetFile)
        {
            return KING_SIDE;
        }
        if (kingTargetFile == QUEEN_SIDE.kingTargetFile)
        {
            return QUEEN_SIDE;
        }
        return null;
    }
}
