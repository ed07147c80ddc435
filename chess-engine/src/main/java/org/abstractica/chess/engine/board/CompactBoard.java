package org.abstractica.chess.engine.board;

import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size binary encoding of a board.
 *
 * <p>Each square takes 4 bits: the low 3 bits hold the piece kind code
 * ({@link PieceKind#code()}) and the high bit is set for black pieces.
 * An empty square is 0. Sixteen squares fit in one {@code long}, so the
 * whole board is four words (32 bytes). Square index {@code rank * 8 + file}
 * lives in word {@code index / 16} at bit offset {@code (index % 16) * 4}.</p>
 *
 * <p>Two boards compare equal for repetition purposes iff their compacted
 * forms are bit-identical.</p>
 */
public final class CompactBoard
{
    /**
     * Size of the byte encoding.
     */
    public static final int BYTES = 32;

    private static final int WORDS = 4;
    private static final int SQUARES_PER_WORD = 16;
    private static final int COLOR_BIT = 0b1000;
    private static final int KIND_MASK = 0b0111;

    private final long[] words;

    private CompactBoard(long[] words)
    {
        this.words = words;
    }

    /**
     * Compacts a board.
     *
     * @param board the board
     * @return the compacted form
     */
    public static CompactBoard of(Board board)
    {
        Objects.requireNonNull(board, "board");
        long[] words = new long[WORDS];
        for (int index = 0; index < 64; index++)
        {
            Square square = Square.fromIndex(index);
            int nibble = board.get(square).map(CompactBoard::encode).orElse(0);
            words[index / SQUARES_PER_WORD] |= (long) nibble << shift(index);
        }
        return new CompactBoard(words);
    }

    /**
     * Decodes a compacted board from its byte encoding.
     *
     * @param bytes exactly {@link #BYTES} bytes, as produced by {@link #toBytes()}
     * @return the compacted board
     * @throws IllegalArgumentException if the length is wrong or a square holds an invalid code
     */
    public static CompactBoard fromBytes(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES)
        {
            throw new IllegalArgumentException("Compact board must be " + BYTES + " bytes: " + bytes.length);
        }
        long[] words = new long[WORDS];
        for (int i = 0; i < BYTES; i++)
        {
            words[i / 8] = (words[i / 8] << 8) | (bytes[i] & 0xFF);
        }
        CompactBoard compact = new CompactBoard(words);
        for (int index = 0; index < 64; index++)
        {
            int nibble = compact.nibble(index);
            if (nibble != 0 && ((nibble & KIND_MASK) == 0 || (nibble & KIND_MASK) > 6))
            {
                throw new IllegalArgumentException("Invalid square code " + nibble + " at index " + index);
            }
        }
        return compact;
    }

    /**
     * Returns the 32-byte encoding, each word big-endian.
     *
     * @return a fresh byte array
     */
    public byte[] toBytes()
    {
        byte[] bytes = new byte[BYTES];
        for (int w = 0; w < WORDS; w++)
        {
            long word = words[w];
            for (int b = 7; b >= 0; b--)
            {
                bytes[w * 8 + b] = (byte) word;
                word >>>= 8;
            }
        }
        return bytes;
    }

    /**
     * Expands back into a board.
     *
     * @return a new board with the encoded placement
     */
    public Board toBoard()
    {
        Board board = Board.empty();
        for (int index = 0; index < 64; index++)
        {
            int nibble = nibble(index);
            if (nibble != 0)
            {
                Color color = (nibble & COLOR_BIT) != 0 ? Color.BLACK : Color.WHITE;
                board.set(Square.fromIndex(index), Piece.of(color, PieceKind.fromCode(nibble & KIND_MASK)));
            }
        }
        return board;
    }

    private int nibble(int index)
    {
        return (int) (words[index / SQUARES_PER_WORD] >>> shift(index)) & 0xF;
    }

    private static int shift(int index)
    {
        return (index % SQUARES_PER_WORD) * 4;
    }

    private static int encode(Piece piece)
    {
        int nibble = piece.kind().code();
        if (piece.color() == Color.BLACK)
        {
            nibble |= COLOR_BIT;
        }
        return nibble;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        return o instanceof CompactBoard other && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(words);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("CompactBoard[");
        for (int w = 0; w < WORDS; w++)
        {
            if (w > 0)
            {
                sb.append(' ');
            }
            sb.append(String.format("%016x", words[w]));
        }
        return sb.append(']').toString();
    }
}
