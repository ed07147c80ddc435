package org.abstractica.chess.engine.rules;

import org.abstractica.chess.ChessMove;
import org.abstractica.chess.Color;
import org.abstractica.chess.Piece;
import org.abstractica.chess.PieceKind;
import org.abstractica.chess.Square;
import org.abstractica.chess.engine.board.Board;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether moves are legal.
 *
 * <p>Legality has two tiers:</p>
 * <ul>
 *   <li><b>Pseudo-legal</b>: the move fits the piece's movement pattern and
 *       the occupancy of the board.</li>
 *   <li><b>Fully legal</b>: pseudo-legal, and the mover's king is not
 *       attacked once the move is made.</li>
 * </ul>
 *
 * <p>Attack detection uses only piece geometry, never full legality, so
 * evaluating a position never recurses. Castling calls attack detection
 * but attack detection never considers castling.</p>
 *
 * <p>All methods are pure functions of their arguments.</p>
 */
public final class MoveValidator
{
    private static final int[][] KNIGHT_JUMPS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    private MoveValidator()
    {
    }

    // ========== Full Legality ==========

    /**
     * Returns whether a move is fully legal in the given state.
     *
     * @param state the game state
     * @param move  the candidate move
     * @return true if pseudo-legal and the mover's king is safe afterwards
     */
    public static boolean isLegal(GameState state, ChessMove move)
    {
        return isPseudoLegal(state, move) && !leavesKingInCheck(state, move);
    }

    /**
     * Lists every fully legal move for the side to move.
     *
     * <p>Tests every from/to pair on the board.</p>
     *
     * @param state the game state
     * @return legal moves, ordered by source then destination square index
     */
    public static List<ChessMove> legalMoves(GameState state)
    {
        List<ChessMove> moves = new ArrayList<>();
        Board board = state.boardView();
        for (int from = 0; from < 64; from++)
        {
            Square source = Square.fromIndex(from);
            if (!board.isOccupiedBy(source, state.turn()))
            {
                continue;
            }
            for (int to = 0; to < 64; to++)
            {
                ChessMove move = new ChessMove(source, Square.fromIndex(to));
                if (isLegal(state, move))
                {
                    moves.add(move);
                }
            }
        }
        return moves;
    }

    /**
     * Returns whether the side to move has at least one fully legal move.
     *
     * @param state the game state
     * @return true if any legal move exists
     */
    public static boolean hasAnyLegalMove(GameState state)
    {
        Board board = state.boardView();
        for (int from = 0; from < 64; from++)
        {
            Square source = Square.fromIndex(from);
            if (!board.isOccupiedBy(source, state.turn()))
            {
                continue;
            }
            for (int to = 0; to < 64; to++)
            {
                if (isLegal(state, new ChessMove(source, Square.fromIndex(to))))
                {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns whether a color's king is attacked.
     *
     * @param state the game state
     * @param color the side whose king to test
     * @return true if the king is in check
     * @throws IllegalStateException if the side has no king
     */
    public static boolean isInCheck(GameState state, Color color)
    {
        Board board = state.boardView();
        return isSquareAttacked(board, requireKing(board, color), color.opposite());
    }

    /**
     * Returns whether making the move would leave the mover's own king
     * attacked.
     *
     * <p>The move is played on a copy of the board. Only the piece
     * relocation and an en-passant capture are applied; castling rook
     * moves do not affect the mover's king safety.</p>
     *
     * @param state the game state
     * @param move  a move whose source square is occupied
     * @return true if the mover's king is attacked afterwards
     * @throws IllegalStateException if the mover has no king
     */
    public static boolean leavesKingInCheck(GameState state, ChessMove move)
    {
        Board after = state.boardView().copy();
        Optional<Piece> moving = after.get(move.from());
        if (moving.isEmpty())
        {
            return false;
        }
        Piece piece = moving.get();
        if (isEnPassantCapture(after, move, piece))
        {
            after.remove(Square.of(move.from().rank(), move.to().file()));
        }
        after.relocate(move.from(), move.to());
        return isSquareAttacked(after, requireKing(after, piece.color()), piece.color().opposite());
    }

    // ========== Pseudo-Legality ==========

    /**
     * Returns whether a move fits the moving piece's pattern and the board
     * occupancy, ignoring the safety of the mover's king.
     *
     * <p>Rejects outright a move to its own source square, from an empty
     * square, or of a piece not belonging to the side to move.</p>
     *
     * @param state the game state
     * @param move  the candidate move
     * @return true if pseudo-legal
     */
    public static boolean isPseudoLegal(GameState state, ChessMove move)
    {
        if (move.from().equals(move.to()))
        {
            return false;
        }
        Board board = state.boardView();
        Optional<Piece> moving = board.get(move.from());
        if (moving.isEmpty() || moving.get().color() != state.turn())
        {
            return false;
        }
        Color mover = moving.get().color();
        return switch (moving.get().kind())
        {
            case KING -> isKingMove(state, move, mover);
            case QUEEN -> (isStraight(move) || isDiagonal(move)) && isSlideTo(board, move, mover);
            case ROOK -> isStraight(move) && isSlideTo(board, move, mover);
            case BISHOP -> isDiagonal(move) && isSlideTo(board, move, mover);
            case KNIGHT -> isKnightJump(move) && !board.isOccupiedBy(move.to(), mover);
            case PAWN -> isPawnMove(state, move, mover);
        };
    }

    private static boolean isKingMove(GameState state, ChessMove move, Color mover)
    {
        if (isAdjacent(move))
        {
            return !state.boardView().isOccupiedBy(move.to(), mover);
        }
        return move.rankDelta() == 0 && Math.abs(move.fileDelta()) == 2 && isCastlingAllowed(state, move, mover);
    }

    private static boolean isCastlingAllowed(GameState state, ChessMove move, Color mover)
    {
        int home = mover.homeRank();
        if (move.from().rank() != home || move.from().file() != CastlingSide.KING_FILE)
        {
            return false;
        }
        CastlingSide side = CastlingSide.forKingTarget(move.to().file());
        if (side == null || !state.castlingRightsView().canCastle(mover, side))
        {
            return false;
        }

        Board board = state.boardView();
        boolean rookInPlace = board.get(Square.of(home, side.rookFile()))
                .map(p -> p.is(mover, PieceKind.ROOK))
                .orElse(false);
        if (!rookInPlace)
        {
            return false;
        }

        for (int file = CastlingSide.KING_FILE + side.step(); file != side.rookFile(); file += side.step())
        {
            if (!board.isEmpty(Square.of(home, file)))
            {
                return false;
            }
        }

        // Start, crossed and destination squares must all be safe
        Color enemy = mover.opposite();
        for (int file = CastlingSide.KING_FILE; file != side.kingTargetFile() + side.step(); file += side.step())
        {
            if (isSquareAttacked(board, Square.of(home, file), enemy))
            {
                return false;
            }
        }
        return true;
    }

    private static boolean isPawnMove(GameState state, ChessMove move, Color mover)
    {
        Board board = state.boardView();
        int forward = mover.forward();

        if (move.fileDelta() == 0)
        {
            if (move.rankDelta() == forward)
            {
                return board.isEmpty(move.to());
            }
            if (move.rankDelta() == 2 * forward && move.from().rank() == pawnStartRank(mover))
            {
                return board.isEmpty(move.from().offset(forward, 0)) && board.isEmpty(move.to());
            }
            return false;
        }

        if (Math.abs(move.fileDelta()) != 1 || move.rankDelta() != forward)
        {
            return false;
        }
        if (board.isOccupiedBy(move.to(), mover.opposite()))
        {
            return true;
        }
        return isEnPassantTarget(state, move, mover);
    }

    private static boolean isEnPassantTarget(GameState state, ChessMove move, Color mover)
    {
        Optional<Integer> file = state.enPassantFile();
        if (file.isEmpty() || file.get() != move.to().file())
        {
            return false;
        }
        // The capturing pawn stands beside the pawn that just advanced two ranks
        int captureRank = mover.opposite().homeRank() - 3 * mover.forward();
        if (move.from().rank() != captureRank)
        {
            return false;
        }
        Board board = state.boardView();
        boolean enemyPawnBeside = board.get(Square.of(captureRank, move.to().file()))
                .map(p -> p.is(mover.opposite(), PieceKind.PAWN))
                .orElse(false);
        return enemyPawnBeside && board.isEmpty(move.to());
    }

    // ========== Attack Detection ==========

    /**
     * Returns whether any piece of a color attacks a square.
     *
     * <p>A square is attacked if a piece of that color could move onto it
     * by its movement pattern, were an enemy piece standing there. Kings
     * attack adjacent squares only; pawns attack their two forward
     * diagonals only.</p>
     *
     * @param board  the position
     * @param target the square to test
     * @param by     the attacking color
     * @return true if attacked
     */
    public static boolean isSquareAttacked(Board board, Square target, Color by)
    {
        for (int index = 0; index < 64; index++)
        {
            Square from = Square.fromIndex(index);
            if (from.equals(target))
            {
                continue;
            }
            Optional<Piece> piece = board.get(from);
            if (piece.isPresent() && piece.get().color() == by && attacks(board, from, target, piece.get()))
            {
                return true;
            }
        }
        return false;
    }

    private static boolean attacks(Board board, Square from, Square target, Piece piece)
    {
        ChessMove line = new ChessMove(from, target);
        return switch (piece.kind())
        {
            case KING -> isAdjacent(line);
            case QUEEN -> (isStraight(line) || isDiagonal(line)) && isPathClear(board, line);
            case ROOK -> isStraight(line) && isPathClear(board, line);
            case BISHOP -> isDiagonal(line) && isPathClear(board, line);
            case KNIGHT -> isKnightJump(line);
            case PAWN -> line.rankDelta() == piece.color().forward() && Math.abs(line.fileDelta()) == 1;
        };
    }

    // ========== Geometry ==========

    private static boolean isAdjacent(ChessMove move)
    {
        return Math.abs(move.rankDelta()) <= 1 && Math.abs(move.fileDelta()) <= 1;
    }

    private static boolean isStraight(ChessMove move)
    {
        return move.rankDelta() == 0 || move.fileDelta() == 0;
    }

    private static boolean isDiagonal(ChessMove move)
    {
        return Math.abs(move.rankDelta()) == Math.abs(move.fileDelta());
    }

    private static boolean isKnightJump(ChessMove move)
    {
        for (int[] jump : KNIGHT_JUMPS)
        {
            if (move.rankDelta() == jump[0] && move.fileDelta() == jump[1])
            {
                return true;
            }
        }
        return false;
    }

    /**
     * Every square strictly between the endpoints of a straight or diagonal
     * line is empty.
     */
    private static boolean isPathClear(Board board, ChessMove line)
    {
        int rankStep = Integer.signum(line.rankDelta());
        int fileStep = Integer.signum(line.fileDelta());
        Square square = line.from().offset(rankStep, fileStep);
        while (square != null && !square.equals(line.to()))
        {
            if (!board.isEmpty(square))
            {
                return false;
            }
            square = square.offset(rankStep, fileStep);
        }
        return true;
    }

    private static boolean isSlideTo(Board board, ChessMove move, Color mover)
    {
        return isPathClear(board, move) && !board.isOccupiedBy(move.to(), mover);
    }

    // ========== Helpers ==========

    /**
     * Returns whether a move by the given piece is an en-passant capture:
     * a pawn changing file onto an empty square.
     */
    static boolean isEnPassantCapture(Board board, ChessMove move, Piece piece)
    {
        return piece.kind() == PieceKind.PAWN
                && move.fileDelta() != 0
                && board.isEmpty(move.to());
    }

    static int pawnStartRank(Color color)
    {
        return color.homeRank() + color.forward();
    }

    static int promotionRank(Color color)
    {
        return color.opposite().homeRank();
    }

    private static Square requireKing(Board board, Color color)
    {
        return board.findKing(color)
                .orElseThrow(() -> new IllegalStateException("No " + color + " king on the board"));
    }
}
