package org.abstractica.chess;

/**
 * Why a game ended.
 */
public enum EndReason
{
    CHECKMATE,
    STALEMATE,
    RESIGNATION,
    AGREEMENT,
    INSUFFICIENT_MATERIAL,
    FIFTY_MOVE_RULE,
    THREEFOLD_REPETITION
}
