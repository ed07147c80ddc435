package org.abstractica.chess.engine.rules;

import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.Square;
import org.abstractica.chess.engine.board.Board;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes game states in Forsyth-Edwards Notation.
 *
 * <p>Six space-separated fields: placement, side to move, castling
 * availability, en-passant target, half-move clock and full-move number.
 * When parsing, the last two fields may be omitted and default to
 * {@code 0 1}.</p>
 *
 * <p>Castling availability maps onto the "has moved" flags: losing both
 * {@code K} and {@code Q} marks the king as moved, losing one marks that
 * rook as moved.</p>
 */
public final class Fen
{
    /**
     * The standard starting position.
     */
    public static final String STARTING_POSITION = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private Fen()
    {
    }

    /**
     * Formats a game state.
     *
     * @param state the state
     * @return the FEN string
     */
    public static String format(GameState state)
    {
        Objects.requireNonNull(state, "state");
        StringBuilder sb = new StringBuilder(90);
        Board board = state.boardView();

        for (int rank = 7; rank >= 0; rank--)
        {
            int empty = 0;
            for (int file = 0; file < 8; file++)
            {
                Optional<Piece> piece = board.get(Square.of(rank, file));
                if (piece.isEmpty())
                {
                    empty++;
                    continue;
                }
                if (empty > 0)
                {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(piece.get().toFen());
            }
            if (empty > 0)
            {
                sb.append(empty);
            }
            if (rank > 0)
            {
                sb.append('/');
            }
        }

        sb.append(' ').append(state.turn() == Color.WHITE ? 'w' : 'b');
        sb.append(' ').append(formatCastling(state.castlingRightsView()));
        sb.append(' ').append(formatEnPassant(state));
        sb.append(' ').append(state.halfMoveClock());
        sb.append(' ').append(state.fullMoveNumber());
        return sb.toString();
    }

    /**
     * Parses a FEN string into a fresh game state.
     *
     * @param fen the FEN string
     * @return the state, with no promotion pending
     * @throws IllegalArgumentException if the string is malformed
     */
    public static GameState parse(String fen)
    {
        Objects.requireNonNull(fen, "fen");
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 4 && fields.length != 6)
        {
            throw new IllegalArgumentException("FEN must have 4 or 6 fields: " + fen);
        }

        Board board = parsePlacement(fields[0]);
        Color turn = parseTurn(fields[1]);
        CastlingRights rights = parseCastling(fields[2]);
        Integer enPassantFile = parseEnPassant(fields[3], turn);
        int halfMoveClock = fields.length == 6 ? parseNumber(fields[4], 0, "half-move clock") : 0;
        int fullMoveNumber = fields.length == 6 ? parseNumber(fields[5], 1, "full-move number") : 1;

        return new GameState(board, turn, enPassantFile, halfMoveClock, fullMoveNumber, rights);
    }

    private static Board parsePlacement(String placement)
    {
        String[] ranks = placement.split("/");
        if (ranks.length != 8)
        {
            throw new IllegalArgumentException("Placement must have 8 ranks: " + placement);
        }
        Board board = Board.empty();
        for (int i = 0; i < 8; i++)
        {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray())
            {
                if (c >= '1' && c <= '8')
                {
                    file += c - '0';
                }
                else
                {
                    if (file > 7)
                    {
                        throw new IllegalArgumentException("Rank " + (rank + 1) + " overflows: " + ranks[i]);
                    }
                    board.set(Square.of(rank, file), Piece.fromFen(c));
                    file++;
                }
            }
            if (file != 8)
            {
                throw new IllegalArgumentException("Rank " + (rank + 1) + " must span 8 files: " + ranks[i]);
            }
        }
        return board;
    }

    private static Color parseTurn(String field)
    {
        return switch (field)
        {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("Side to move must be 'w' or 'b': " + field);
        };
    }

    private static CastlingRights parseCastling(String field)
    {
        if (!field.matches("-|K?Q?k?q?") || field.isEmpty())
        {
            throw new IllegalArgumentException("Invalid castling field: " + field);
        }
        CastlingRights rights = new CastlingRights();
        markLost(rights, Color.WHITE, field.indexOf('K') < 0, field.indexOf('Q') < 0);
        markLost(rights, Color.BLACK, field.indexOf('k') < 0, field.indexOf('q') < 0);
        return rights;
    }

    private static void markLost(CastlingRights rights, Color color, boolean kingSideLost, boolean queenSideLost)
    {
        if (kingSideLost && queenSideLost)
        {
            rights.markKingMoved(color);
        }
        if (kingSideLost)
        {
            rights.markRookMoved(color, CastlingSide.KING_SIDE);
        }
        if (queenSideLost)
        {
            rights.markRookMoved(color, CastlingSide.QUEEN_SIDE);
        }
    }

    private static Integer parseEnPassant(String field, Color turn)
    {
        if (field.equals("-"))
        {
            return null;
        }
        Square target = Square.of(field);
        // Target is the square the pawn skipped: rank 6 when White is to move, rank 3 when Black is
        int expectedRank = turn == Color.WHITE ? 5 : 2;
        if (target.rank() != expectedRank)
        {
            throw new IllegalArgumentException("En-passant target on wrong rank: " + field);
        }
        return target.file();
    }

    private static int parseNumber(String field, int min, String name)
    {
        try
        {
            int value = Integer.parseInt(field);
            if (value < min)
            {
                throw new IllegalArgumentException("Invalid " + name + ": " + field);
            }
            return value;
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid " + name + ": " + field, e);
        }
    }

    private static String formatCastling(CastlingRights rights)
    {
        StringBuilder sb = new StringBuilder(4);
        if (rights.canCastle(Color.WHITE, CastlingSide.KING_SIDE))
        {
            sb.append('K');
        }
        if (rights.canCastle(Color.WHITE, CastlingSide.QUEEN_SIDE))
        {
            sb.append('Q');
        }
        if (rights.canCastle(Color.BLACK, CastlingSide.KING_SIDE))
        {
            sb.append('k');
        }
        if (rights.canCastle(Color.BLACK, CastlingSide.QUEEN_SIDE))
        {
            sb.append('q');
        }
        return sb.length() == 0 ? "-" : sb.toString();
    }

    private static String formatEnPassant(GameState state)
    {
        Optional<Integer> file = state.enPassantFile();
        if (file.isEmpty())
        {
            return "-";
        }
        int rank = state.turn() == Color.WHITE ? 5 : 2;
        return Square.of(rank, file.get()).toString();
    }
}
