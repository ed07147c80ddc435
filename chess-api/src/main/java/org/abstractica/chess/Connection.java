package org.abstractica.chess;

import org.abstractica.chess.protocol.ServerMessage;

/**
 * A client connection as seen by the game server.
 *
 * <p>Implemented by the transport layer. The server never owns the
 * underlying socket; it only identifies connections by {@link #getId()},
 * sends them notifications and asks the transport to drop them.</p>
 *
 * <p>Implementations must be safe to call from the server's tick thread
 * while the transport uses its own threads.</p>
 */
public interface Connection
{
    /**
     * Returns the unique connection identifier.
     *
     * <p>Two connection handles with the same id refer to the same client.</p>
     *
     * @return connection ID
     */
    String getId();

    /**
     * Sends a notification to the client.
     *
     * @param message the message to send
     */
    void send(ServerMessage message);

    /**
     * Closes the connection.
     *
     * <p>Calling this on an already closed connection has no effect.</p>
     */
    void disconnect();
}
