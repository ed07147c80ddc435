package org.abstractica.chess.server;

/**
 * Where a connection stands in the matchmaking lifecycle.
 */
public enum ConnectionState
{
    /**
     * Waiting in the queue for an opponent.
     */
    QUEUED,

    /**
     * Playing in a game.
     */
    PAIRED,

    /**
     * Not tracked: never connected, or its game ended, or it disconnected.
     */
    DETACHED
}
