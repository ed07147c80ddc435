package org.abstractica.chess.server;

import org.abstractica.chess.Connection;
import org.abstractica.chess.engine.rules.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Tracks waiting connections and running games.
 *
 * <p>A connection is in at most one place at a time: the waiting queue,
 * or exactly one game. Both players of a game map to it, and the game is
 * removed for both at once.</p>
 *
 * <p>Not thread-safe. Only the tick thread touches the registry.</p>
 */
public class SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final List<Connection> waitingQueue;
    private final Map<String, Game> gamesByConnection;
    private final Map<Long, Game> games;
    private long nextGameId;

    /**
     * Creates an empty registry.
     */
    public SessionRegistry()
    {
        this.waitingQueue = new ArrayList<>();
        this.gamesByConnection = new HashMap<>();
        this.games = new LinkedHashMap<>();
        this.nextGameId = 1;
    }

    // ========== Waiting Queue ==========

    /**
     * Adds a connection to the waiting queue.
     *
     * @param connection the new connection
     * @return false if the connection is already queued or playing
     */
    public boolean enqueue(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");
        if (stateOf(connection) != ConnectionState.DETACHED)
        {
            return false;
        }
        waitingQueue.add(connection);
        return true;
    }

    /**
     * Removes a connection from the waiting queue.
     *
     * @param connection the connection
     * @return true if it was queued
     */
    public boolean removeFromQueue(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");
        return waitingQueue.removeIf(c -> c.getId().equals(connection.getId()));
    }

    public int getQueuedCount()
    {
        return waitingQueue.size();
    }

    /**
     * Returns the waiting connections in arrival order.
     *
     * @return unmodifiable view of the queue
     */
    public List<Connection> getQueued()
    {
        return Collections.unmodifiableList(waitingQueue);
    }

    // ========== Pairing ==========

    /**
     * Takes two waiting connections chosen uniformly at random, assigns
     * colors uniformly at random and registers a new game for them.
     *
     * @param random the random source
     * @return the new game, or empty if fewer than two are waiting
     */
    public Optional<Game> pairRandom(Random random)
    {
        Objects.requireNonNull(random, "random");
        if (waitingQueue.size() < 2)
        {
            return Optional.empty();
        }

        Connection first = waitingQueue.remove(random.nextInt(waitingQueue.size()));
        Connection second = waitingQueue.remove(random.nextInt(waitingQueue.size()));

        Game game = random.nextBoolean()
                ? new Game(nextGameId++, first, second)
                : new Game(nextGameId++, second, first);
        register(game);
        return Optional.of(game);
    }

    /**
     * Registers a game between two connections starting from a given
     * position.
     *
     * <p>Both connections are taken out of the waiting queue if present.</p>
     *
     * @param white the white player
     * @param black the black player
     * @param state the starting state
     * @return the registered game
     * @throws IllegalStateException if either connection is already playing
     */
    Game createGame(Connection white, Connection black, GameState state)
    {
        if (stateOf(white) == ConnectionState.PAIRED || stateOf(black) == ConnectionState.PAIRED)
        {
            throw new IllegalStateException("Connection already in a game");
        }
        removeFromQueue(white);
        removeFromQueue(black);
        Game game = new Game(nextGameId++, white, black, state);
        register(game);
        return game;
    }

    private void register(Game game)
    {
        games.put(game.getId(), game);
        gamesByConnection.put(game.getWhite().getId(), game);
        gamesByConnection.put(game.getBlack().getId(), game);
        LOG.debug("Registered {}", game);
    }

    // ========== Game Lookup ==========

    /**
     * Finds the game a connection is playing in.
     *
     * @param connection the connection
     * @return the game, or empty if the connection is not playing
     */
    public Optional<Game> findGame(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");
        return Optional.ofNullable(gamesByConnection.get(connection.getId()));
    }

    public Optional<Game> getGame(long id)
    {
        return Optional.ofNullable(games.get(id));
    }

    /**
     * Returns all running games.
     *
     * @return unmodifiable collection of games
     */
    public Collection<Game> getGames()
    {
        return Collections.unmodifiableCollection(games.values());
    }

    public int getActiveGameCount()
    {
        return games.size();
    }

    /**
     * Removes a game and both of its player mappings.
     *
     * @param game the game
     * @return true if the game was registered
     */
    public boolean removeGame(Game game)
    {
        Objects.requireNonNull(game, "game");
        if (games.remove(game.getId()) == null)
        {
            return false;
        }
        gamesByConnection.remove(game.getWhite().getId());
        gamesByConnection.remove(game.getBlack().getId());
        LOG.debug("Removed {}", game);
        return true;
    }

    /**
     * Returns where a connection stands.
     *
     * @param connection the connection
     * @return its lifecycle state
     */
    public ConnectionState stateOf(Connection connection)
    {
        String id = connection.getId();
        if (gamesByConnection.containsKey(id))
        {
            return ConnectionState.PAIRED;
        }
        for (Connection queued : waitingQueue)
        {
            if (queued.getId().equals(id))
            {
                return ConnectionState.QUEUED;
            }
        }
        return ConnectionState.DETACHED;
    }

    /**
     * Removes everything and returns every connection that was tracked.
     *
     * @return the queued connections followed by both players of each game
     */
    public List<Connection> clear()
    {
        List<Connection> all = new ArrayList<>(waitingQueue);
        for (Game game : games.values())
        {
            all.add(game.getWhite());
            all.add(game.getBlack());
        }
        waitingQueue.clear();
        games.clear();
        gamesByConnection.clear();
        return all;
    }
}
