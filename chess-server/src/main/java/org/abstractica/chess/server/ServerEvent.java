package org.abstractica.chess.server;

import org.abstractica.chess.Connection;
import org.abstractica.chess.DisconnectReason;
import org.abstractica.chess.protocol.ClientMessage;

import java.util.Objects;

/**
 * Events queued for the tick thread.
 *
 * <p>Transport threads only create events; the tick thread handles them in
 * the order they were queued.</p>
 */
public sealed interface ServerEvent
{
    /**
     * Returns the connection the event belongs to.
     *
     * @return the connection
     */
    Connection connection();

    /**
     * A client connected and wants an opponent.
     */
    record Connected(Connection connection) implements ServerEvent
    {
        public Connected
        {
            Objects.requireNonNull(connection, "connection");
        }
    }

    /**
     * A client sent a command.
     */
    record Received(Connection connection, ClientMessage message) implements ServerEvent
    {
        public Received
        {
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * A client connection was lost.
     */
    record Disconnected(Connection connection, DisconnectReason reason) implements ServerEvent
    {
        public Disconnected
        {
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
