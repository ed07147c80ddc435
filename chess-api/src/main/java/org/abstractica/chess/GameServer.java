package org.abstractica.chess;

import org.abstractica.chess.handlers.ErrorHandler;
import org.abstractica.chess.protocol.ClientMessage;

/**
 * Pairs waiting clients into games and referees them.
 *
 * <p>The transport reports connection events through {@link #connected},
 * {@link #received} and {@link #disconnected}. Those calls only queue the
 * event; all game state is owned by a single tick thread that handles one
 * event to completion before the next.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GameServer server = new DefaultGameServerFactory().builder()
 *     .tickInterval(Duration.ofMillis(20))
 *     .build();
 *
 * server.onError((connection, message, exception) ->
 *     log.error("Game torn down", exception));
 *
 * server.start();
 *
 * // from the transport:
 * server.connected(connection);
 * server.received(connection, new ClientMessage.Move(Square.of("e2"), Square.of("e4")));
 * server.disconnected(connection, new DisconnectReason.Timeout());
 * }</pre>
 */
public interface GameServer extends AutoCloseable
{
    /**
     * Starts the tick thread.
     *
     * <p>This method returns immediately.</p>
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * Stops the tick thread and disconnects every client, including those
     * whose connect event was still queued.
     */
    @Override
    void close();

    /**
     * Processes the events queued so far on the calling thread, then pairs
     * waiting connections.
     *
     * <p>For embedders that drive the server themselves instead of calling
     * {@link #start()}.</p>
     *
     * @return the number of events handled
     * @throws IllegalStateException if the tick thread is running
     */
    int tick();

    /**
     * Reports a new client connection.
     *
     * @param connection the connection
     */
    void connected(Connection connection);

    /**
     * Reports a command received from a client.
     *
     * @param connection the sending connection
     * @param message    the command
     */
    void received(Connection connection, ClientMessage message);

    /**
     * Reports that a client connection was lost.
     *
     * @param connection the connection
     * @param reason     why it was lost
     */
    void disconnected(Connection connection, DisconnectReason reason);

    /**
     * Registers a handler notified when a game is torn down because of an
     * internal error.
     *
     * @param handler the error handler
     */
    void onError(ErrorHandler handler);

    /**
     * Returns server statistics.
     *
     * @return current statistics snapshot
     */
    ServerStats getStats();
}
