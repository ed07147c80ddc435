package org.abstractica.chess.handlers;

import org.abstractica.chess.Connection;

/**
 * Handles exceptions thrown while processing a client command.
 *
 * <p>When a command handler throws, the server logs the exception, tears
 * down the affected game and invokes this handler. Other games keep
 * running; one broken game should not crash the server.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a command handler.
     *
     * @param connection the connection whose command failed
     * @param command    the command that caused the error
     * @param exception  the exception thrown by the handler
     */
    void handle(Connection connection, Object command, Exception exception);
}
