package org.abstractica.chess.server;

import org.abstractica.chess.GameServer;
import org.abstractica.chess.GameServerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Default implementation of GameServerFactory.
 *
 * <p>Creates DefaultGameServer instances using a builder pattern.</p>
 */
public class DefaultGameServerFactory implements GameServerFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private Random random;
        private Duration tickInterval = Duration.ofMillis(50);
        private int maxEventsPerTick = 256;
        private int eventQueueCapacity = 4096;

        @Override
        public Builder random(Random random)
        {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        @Override
        public Builder tickInterval(Duration interval)
        {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative() || interval.isZero())
            {
                throw new IllegalArgumentException("Tick interval must be positive");
            }
            this.tickInterval = interval;
            return this;
        }

        @Override
        public Builder maxEventsPerTick(int max)
        {
            if (max <= 0)
            {
                throw new IllegalArgumentException("maxEventsPerTick must be positive: " + max);
            }
            this.maxEventsPerTick = max;
            return this;
        }

        @Override
        public Builder eventQueueCapacity(int capacity)
        {
            if (capacity <= 0)
            {
                throw new IllegalArgumentException("eventQueueCapacity must be positive: " + capacity);
            }
            this.eventQueueCapacity = capacity;
            return this;
        }

        @Override
        public GameServer build()
        {
            Random source = random != null ? random : new SecureRandom();
            return new DefaultGameServer(source, tickInterval, maxEventsPerTick, eventQueueCapacity);
        }
    }
}
