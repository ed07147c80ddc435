package org.abstractica.chess.engine.rules;

import org.abstractica.chess.Color;
import org.abstractica.chess.Square;

import java.util.Objects;

/**
 * Irreversible "has moved" flags for both kings and all four corner rooks.
 *
 * <p>A flag is set whenever a move vacates or lands on the piece's original
 * square, so a captured rook counts as moved. Flags are never cleared.</p>
 */
public final class CastlingRights
{
    private boolean whiteKingMoved;
    private boolean blackKingMoved;
    private boolean whiteARookMoved;
    private boolean blackARookMoved;
    private boolean whiteHRookMoved;
    private boolean blackHRookMoved;

    /**
     * Creates rights with nothing moved yet.
     */
    public CastlingRights()
    {
    }

    private CastlingRights(CastlingRights other)
    {
        this.whiteKingMoved = other.whiteKingMoved;
        this.blackKingMoved = other.blackKingMoved;
        this.whiteARookMoved = other.whiteARookMoved;
        this.blackARookMoved = other.blackARookMoved;
        this.whiteHRookMoved = other.whiteHRookMoved;
        this.blackHRookMoved = other.blackHRookMoved;
    }

    public boolean hasKingMoved(Color color)
    {
        return color == Color.WHITE ? whiteKingMoved : blackKingMoved;
    }

    public boolean hasRookMoved(Color color, CastlingSide side)
    {
        if (side == CastlingSide.KING_SIDE)
        {
            return color == Color.WHITE ? whiteHRookMoved : blackHRookMoved;
        }
        return color == Color.WHITE ? whiteARookMoved : blackARookMoved;
    }

    /**
     * Returns whether the color may still castle towards the given side,
     * judged on the flags alone.
     */
    public boolean canCastle(Color color, CastlingSide side)
    {
        return !hasKingMoved(color) && !hasRookMoved(color, side);
    }

    void markKingMoved(Color color)
    {
        if (color == Color.WHITE)
        {
            whiteKingMoved = true;
        }
        else
        {
            blackKingMoved = true;
        }
    }

    void markRookMoved(Color color, CastlingSide side)
    {
        if (side == CastlingSide.KING_SIDE)
        {
            if (color == Color.WHITE)
            {
                whiteHRookMoved = true;
            }
            else
            {
                blackHRookMoved = true;
            }
        }
        else if (color == Color.WHITE)
        {
            whiteARookMoved = true;
        }
        else
        {
            blackARookMoved = true;
        }
    }

    /**
     * Sets every flag whose original square is the given square.
     *
     * @param square a square vacated or occupied by a move
     */
    void touch(Square square)
    {
        for (Color color : Color.values())
        {
            if (square.rank() != color.homeRank())
            {
                continue;
            }
            if (square.file() == CastlingSide.KING_FILE)
            {
                markKingMoved(color);
            }
            for (CastlingSide side : CastlingSide.values())
            {
                if (square.file() == side.rookFile())
                {
                    markRookMoved(color, side);
                }
            }
        }
    }

    CastlingRights copy()
    {
        return new CastlingRights(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof CastlingRights other))
        {
            return false;
        }
        return whiteKingMoved == other.whiteKingMoved
                && blackKingMoved == other.blackKingMoved
                && whiteARookMoved == other.whiteARookMoved
                && blackARookMoved == other.blackARookMoved
                && whiteHRookMoved == other.whiteHRookMoved
                && blackHRookMoved == other.blackHRookMoved;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(whiteKingMoved, blackKingMoved, whiteARookMoved,
                blackARookMoved, whiteHRookMoved, blackHRookMoved);
    }

    @Override
    public String toString()
    {
        return "CastlingRights[whiteKingMoved=" + whiteKingMoved
                + ", blackKingMoved=" + blackKingMoved
                + ", whiteARookMoved=" + whiteARookMoved
                + ", blackARookMoved=" + blackARookMoved
                + ", whiteHRookMoved=" + whiteHRookMoved
                + ", blackHRookMoved=" + blackHRookMoved + "]";
    }
}
