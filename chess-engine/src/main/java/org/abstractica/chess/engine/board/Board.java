package org.abstractica.chess.engine.board;

import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * An 8x8 grid of optional pieces.
 *
 * <p>Indexed by rank then file. A board holds at most one piece per square
 * but does not enforce any chess rule; that is the job of the rules
 * package.</p>
 */
public final class Board
{
    private static final PieceKind[] BACK_RANK = {
            PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
            PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    private final Piece[][] squares;

    private Board(Piece[][] squares)
    {
        this.squares = squares;
    }

    /**
     * Creates a board with no pieces.
     *
     * @return an empty board
     */
    public static Board empty()
    {
        return new Board(new Piece[8][8]);
    }

    /**
     * Creates a board with the standard starting position.
     *
     * @return the starting position
     */
    public static Board standard()
    {
        Board board = empty();
        for (int file = 0; file < 8; file++)
        {
            board.squares[0][file] = Piece.of(Color.WHITE, BACK_RANK[file]);
            board.squares[1][file] = Piece.of(Color.WHITE, PieceKind.PAWN);
            board.squares[6][file] = Piece.of(Color.BLACK, PieceKind.PAWN);
            board.squares[7][file] = Piece.of(Color.BLACK, BACK_RANK[file]);
        }
        return board;
    }

    /**
     * Returns the piece on a square.
     *
     * @param square the square
     * @return the piece, or empty if the square is vacant
     */
    public Optional<Piece> get(Square square)
    {
        return Optional.ofNullable(squares[square.rank()][square.file()]);
    }

    /**
     * Returns whether a square is vacant.
     */
    public boolean isEmpty(Square square)
    {
        return squares[square.rank()][square.file()] == null;
    }

    /**
     * Returns whether a square holds a piece of the given color.
     */
    public boolean isOccupiedBy(Square square, Color color)
    {
        Piece piece = squares[square.rank()][square.file()];
        return piece != null && piece.color() == color;
    }

    /**
     * Places a piece on a square, replacing whatever was there.
     *
     * @param square the square
     * @param piece  the piece
     */
    public void set(Square square, Piece piece)
    {
        Objects.requireNonNull(piece, "piece");
        squares[square.rank()][square.file()] = piece;
    }

    /**
     * Removes the piece from a square.
     *
     * @param square the square
     * @return the removed piece, or empty if the square was vacant
     */
    public Optional<Piece> remove(Square square)
    {
        Piece piece = squares[square.rank()][square.file()];
        squares[square.rank()][square.file()] = null;
        return Optional.ofNullable(piece);
    }

    /**
     * Moves the piece on {@code from} to {@code to}, overwriting any piece
     * standing there. Does nothing if {@code from} is vacant.
     *
     * @param from source square
     * @param to   destination square
     */
    public void relocate(Square from, Square to)
    {
        Piece piece = squares[from.rank()][from.file()];
        if (piece == null)
        {
            return;
        }
        squares[from.rank()][from.file()] = null;
        squares[to.rank()][to.file()] = piece;
    }

    /**
     * Finds the king of a color.
     *
     * @param color the side
     * @return the king's square, or empty if the side has no king
     */
    public Optional<Square> findKing(Color color)
    {
        for (int rank = 0; rank < 8; rank++)
        {
            for (int file = 0; file < 8; file++)
            {
                Piece piece = squares[rank][file];
                if (piece != null && piece.is(color, PieceKind.KING))
                {
                    return Optional.of(Square.of(rank, file));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the number of pieces on the board.
     *
     * @return piece count
     */
    public int pieceCount()
    {
        int count = 0;
        for (Piece[] rank : squares)
        {
            for (Piece piece : rank)
            {
                if (piece != null)
                {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Returns an independent copy of this board.
     *
     * @return the copy
     */
    public Board copy()
    {
        Piece[][] copy = new Piece[8][];
        for (int rank = 0; rank < 8; rank++)
        {
            copy[rank] = squares[rank].clone();
        }
        return new Board(copy);
    }

    /**
     * Packs this board into its compacted form.
     *
     * @return the compacted board
     */
    public CompactBoard compact()
    {
        return CompactBoard.of(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof Board other))
        {
            return false;
        }
        return Arrays.deepEquals(squares, other.squares);
    }

    @Override
    public int hashCode()
    {
        return Arrays.deepHashCode(squares);
    }

    /**
     * Renders the board with rank 8 on top, one line per rank, using FEN
     * letters and '.' for empty squares.
     */
    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(72);
        for (int rank = 7; rank >= 0; rank--)
        {
            for (int file = 0; file < 8; file++)
            {
                Piece piece = squares[rank][file];
                sb.append(piece == null ? '.' : piece.toFen());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
