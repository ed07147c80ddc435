package org.abstractica.chess;

import java.io.IOException;

/**
 * Reason a connection was lost, as reported by the transport.
 */
public sealed interface DisconnectReason
{
    /**
     * Network-level error occurred.
     *
     * @param cause the underlying I/O exception
     */
    record NetworkError(IOException cause) implements DisconnectReason {}

    /**
     * Connection timed out.
     */
    record Timeout() implements DisconnectReason {}

    /**
     * The client closed the connection.
     */
    record ClosedByClient() implements DisconnectReason {}

    /**
     * The server is shutting down.
     */
    record ServerShutdown() implements DisconnectReason {}
}
