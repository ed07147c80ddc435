package org.abstractica.chess.handlers;

import org.abstractica.chess.Connection;

/**
 * Handles incoming client commands of a specific type.
 *
 * <p>Handlers are registered per command type and invoked on the server's
 * tick thread.</p>
 *
 * @param <T> the command type this handler processes
 */
@FunctionalInterface
public interface CommandHandler<T>
{
    /**
     * Handles an incoming command.
     *
     * @param connection the connection that sent the command
     * @param command    the command to handle
     */
    void handle(Connection connection, T command);
}
