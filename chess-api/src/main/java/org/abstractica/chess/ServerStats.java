package org.abstractica.chess;

/**
 * Server statistics for monitoring.
 *
 * <p>Values are snapshots published by the server's tick thread and may
 * be read from any thread.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of connections waiting for an opponent.
     *
     * @return queued connection count
     */
    int getQueuedConnections();

    /**
     * Returns the number of games in progress.
     *
     * @return active game count
     */
    int getActiveGames();

    /**
     * Returns the total number of moves accepted since start.
     *
     * @return accepted move count
     */
    long getMovesApplied();

    /**
     * Returns the total number of moves rejected since start.
     *
     * @return rejected move count
     */
    long getMovesRejected();

    /**
     * Returns the total number of games that have ended since start.
     *
     * @return finished game count
     */
    long getGamesFinished();
}
