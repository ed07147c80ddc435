package org.abstractica.chess;

import java.time.Duration;
import java.util.Random;

/**
 * Factory for creating game servers.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GameServer server = factory.builder()
 *     .tickInterval(Duration.ofMillis(20))
 *     .maxEventsPerTick(512)
 *     .build();
 * }</pre>
 */
public interface GameServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a GameServer.
     */
    interface Builder
    {
        /**
         * Sets the random source used to pick opponents and assign colors.
         *
         * <p>Default: a new {@link java.security.SecureRandom}.</p>
         *
         * @param random the random source
         * @return this builder
         */
        Builder random(Random random);

        /**
         * Sets how long the tick thread waits for an event before it runs
         * an empty tick.
         *
         * <p>Default: 50 milliseconds.</p>
         *
         * @param interval the wait time
         * @return this builder
         */
        Builder tickInterval(Duration interval);

        /**
         * Sets the most events handled in a single tick.
         *
         * <p>Default: 256.</p>
         *
         * @param max the limit, at least 1
         * @return this builder
         */
        Builder maxEventsPerTick(int max);

        /**
         * Sets how many events may wait for the tick thread.
         *
         * <p>Events reported while the queue is full are dropped; a dropped
         * new connection is disconnected. Default: 4096.</p>
         *
         * @param capacity the queue capacity, at least 1
         * @return this builder
         */
        Builder eventQueueCapacity(int capacity);

        /**
         * Builds the server.
         *
         * @return the constructed server, not yet started
         */
        GameServer build();
    }
}
