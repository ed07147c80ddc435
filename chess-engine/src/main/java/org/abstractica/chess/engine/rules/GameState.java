package org.abstractica.chess.engine.rules;

import org.abstractica.chess.ChessMove;
import org.abstractica.chess.Color;
import org.abstractica.chess.GameSnapshot;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.abstractica.chess.engine.board.Board;
import org.abstractica.chess.engine.board.CompactBoard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative state of one game.
 *
 * <p>Mutated only through {@link #applyMove(ChessMove)} and
 * {@link #promote(PieceKind)}, both of which validate first and leave the
 * state untouched when they reject.</p>
 *
 * <p>Not thread-safe. A game state is owned by exactly one thread.</p>
 */
public final class GameState
{
    private static final Logger LOG = LoggerFactory.getLogger(GameState.class);

    private final Board board;
    private final CastlingRights castlingRights;
    private Color turn;
    private Integer enPassantFile;
    private int halfMoveClock;
    private int fullMoveNumber;
    private Square promotionSquare;

    GameState(
            Board board,
            Color turn,
            Integer enPassantFile,
            int halfMoveClock,
            int fullMoveNumber,
            CastlingRights castlingRights
    )
    {
        this.board = Objects.requireNonNull(board, "board");
        this.turn = Objects.requireNonNull(turn, "turn");
        this.castlingRights = Objects.requireNonNull(castlingRights, "castlingRights");
        this.enPassantFile = enPassantFile;
        this.halfMoveClock = halfMoveClock;
        this.fullMoveNumber = fullMoveNumber;
        this.promotionSquare = null;
    }

    /**
     * Creates a game in the standard starting position, White to move.
     *
     * @return a new game state
     */
    public static GameState standard()
    {
        return new GameState(Board.standard(), Color.WHITE, null, 0, 1, new CastlingRights());
    }

    // ========== Transitions ==========

    /**
     * Plays a move.
     *
     * <p>Handles captures, en passant, castling (the rook moves with the
     * king), the half-move clock, castling flags and the en-passant file.
     * A pawn reaching its last rank leaves a promotion pending; no move is
     * accepted until {@link #promote(PieceKind)} resolves it.</p>
     *
     * @param move the move
     * @return true if squares other than {@code from} and {@code to} changed
     *         (en passant or castling), so a full redraw is needed
     * @throws InvalidMoveException if a promotion is pending or the move is illegal;
     *                              the state is unchanged
     */
    public boolean applyMove(ChessMove move)
    {
        Objects.requireNonNull(move, "move");
        if (promotionSquare != null)
        {
            throw new InvalidMoveException(move, "Promotion pending");
        }
        if (!MoveValidator.isLegal(this, move))
        {
            throw new InvalidMoveException(move, "Illegal move");
        }

        Piece piece = board.get(move.from()).orElseThrow();
        boolean pawnMove = piece.kind() == PieceKind.PAWN;
        boolean capture = !board.isEmpty(move.to());
        boolean redraw = false;

        if (MoveValidator.isEnPassantCapture(board, move, piece))
        {
            board.remove(Square.of(move.from().rank(), move.to().file()));
            capture = true;
            redraw = true;
        }

        halfMoveClock = (capture || pawnMove) ? 0 : halfMoveClock + 1;

        board.relocate(move.from(), move.to());

        enPassantFile = (pawnMove && Math.abs(move.rankDelta()) == 2) ? move.to().file() : null;

        castlingRights.touch(move.from());
        castlingRights.touch(move.to());

        if (piece.kind() == PieceKind.KING && Math.abs(move.fileDelta()) == 2)
        {
            CastlingSide side = CastlingSide.forKingTarget(move.to().file());
            int rank = move.from().rank();
            board.relocate(Square.of(rank, side.rookFile()), Square.of(rank, side.rookTargetFile()));
            redraw = true;
        }

        if (pawnMove && move.to().rank() == MoveValidator.promotionRank(piece.color()))
        {
            promotionSquare = move.to();
            LOG.debug("Promotion pending on {}", move.to());
        }

        if (turn == Color.BLACK)
        {
            fullMoveNumber++;
        }
        turn = turn.opposite();
        return redraw;
    }

    /**
     * Replaces the pawn awaiting promotion with the chosen piece.
     *
     * <p>Does not change the side to move; that already happened when the
     * pawn arrived.</p>
     *
     * @param kind the piece kind to promote to
     * @throws InvalidPromotionException if no promotion is pending or the kind
     *                                   is king or pawn; the state is unchanged
     */
    public void promote(PieceKind kind)
    {
        Objects.requireNonNull(kind, "kind");
        if (promotionSquare == null)
        {
            throw new InvalidPromotionException("No promotion pending");
        }
        if (!kind.isPromotionTarget())
        {
            throw new InvalidPromotionException("Cannot promote to " + kind);
        }
        Piece pawn = board.get(promotionSquare)
                .orElseThrow(() -> new IllegalStateException("No pawn on promotion square " + promotionSquare));
        board.set(promotionSquare, Piece.of(pawn.color(), kind));
        LOG.debug("Promoted {} pawn on {} to {}", pawn.color(), promotionSquare, kind);
        promotionSquare = null;
    }

    // ========== Queries ==========

    public Color turn()
    {
        return turn;
    }

    /**
     * Returns the file of the pawn that just advanced two ranks.
     *
     * @return the file (0-7), or empty if the last move was not a double push
     */
    public Optional<Integer> enPassantFile()
    {
        return Optional.ofNullable(enPassantFile);
    }

    /**
     * Returns the number of moves since the last capture or pawn move.
     */
    public int halfMoveClock()
    {
        return halfMoveClock;
    }

    public int fullMoveNumber()
    {
        return fullMoveNumber;
    }

    public boolean isPromotionPending()
    {
        return promotionSquare != null;
    }

    /**
     * Returns the square of the pawn awaiting promotion.
     *
     * @return the square, or empty if no promotion is pending
     */
    public Optional<Square> promotionSquare()
    {
        return Optional.ofNullable(promotionSquare);
    }

    /**
     * Returns the color that must pick the promotion piece.
     *
     * @return the promoting side, or empty if no promotion is pending
     */
    public Optional<Color> promotingColor()
    {
        return promotionSquare().flatMap(board::get).map(Piece::color);
    }

    public Optional<Piece> pieceAt(Square square)
    {
        return board.get(square);
    }

    /**
     * Returns a copy of the board.
     *
     * @return an independent board
     */
    public Board board()
    {
        return board.copy();
    }

    /**
     * Returns a copy of the castling flags.
     */
    public CastlingRights castlingRights()
    {
        return castlingRights.copy();
    }

    public CompactBoard compactBoard()
    {
        return board.compact();
    }

    /**
     * Returns a serializable snapshot of the full state.
     *
     * @return the snapshot
     */
    public GameSnapshot snapshot()
    {
        return new GameSnapshot(Fen.format(this), isPromotionPending());
    }

    /**
     * Returns an independent copy of this state.
     *
     * @return the copy
     */
    public GameState copy()
    {
        GameState copy = new GameState(board.copy(), turn, enPassantFile, halfMoveClock,
                fullMoveNumber, castlingRights.copy());
        copy.promotionSquare = promotionSquare;
        return copy;
    }

    Board boardView()
    {
        return board;
    }

    CastlingRights castlingRightsView()
    {
        return castlingRights;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof GameState other))
        {
            return false;
        }
        return halfMoveClock == other.halfMoveClock
                && fullMoveNumber == other.fullMoveNumber
                && turn == other.turn
                && board.equals(other.board)
                && castlingRights.equals(other.castlingRights)
                && Objects.equals(enPassantFile, other.enPassantFile)
                && Objects.equals(promotionSquare, other.promotionSquare);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(board, castlingRights, turn, enPassantFile, halfMoveClock,
                fullMoveNumber, promotionSquare);
    }

    @Override
    public String toString()
    {
        return Fen.format(this) + (isPromotionPending() ? " (promotion pending on " + promotionSquare + ")" : "");
    }
}
