package org.abstractica.chess.server;

import org.abstractica.chess.ServerStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Counters are updated by the tick thread. Queue and game counts are
 * published at the end of each tick so other threads never read the
 * registry directly.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final AtomicLong movesApplied = new AtomicLong(0);
    private final AtomicLong movesRejected = new AtomicLong(0);
    private final AtomicLong gamesFinished = new AtomicLong(0);

    private volatile int queuedConnections = 0;
    private volatile int activeGames = 0;

    @Override
    public int getQueuedConnections()
    {
        return queuedConnections;
    }

    @Override
    public int getActiveGames()
    {
        return activeGames;
    }

    @Override
    public long getMovesApplied()
    {
        return movesApplied.get();
    }

    @Override
    public long getMovesRejected()
    {
        return movesRejected.get();
    }

    @Override
    public long getGamesFinished()
    {
        return gamesFinished.get();
    }

    // ========== Internal Methods ==========

    void recordMoveApplied()
    {
        movesApplied.incrementAndGet();
    }

    void recordMoveRejected()
    {
        movesRejected.incrementAndGet();
    }

    void recordGameFinished()
    {
        gamesFinished.incrementAndGet();
    }

    void publish(SessionRegistry registry)
    {
        queuedConnections = registry.getQueuedCount();
        activeGames = registry.getActiveGameCount();
    }

    @Override
    public String toString()
    {
        return String.format("ServerStats[queued=%d, games=%d, applied=%d, rejected=%d, finished=%d]",
                queuedConnections, activeGames, movesApplied.get(), movesRejected.get(), gamesFinished.get());
    }
}
