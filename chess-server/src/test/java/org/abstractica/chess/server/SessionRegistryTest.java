package org.abstractica.chess.server;

import org.abstractica.chess.Color;
import org.abstractica.chess.engine.rules.Fen;
import org.abstractica.chess.engine.rules.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionRegistry}.
 */
class SessionRegistryTest
{
    private SessionRegistry registry;
    private RecordingConnection alice;
    private RecordingConnection bob;
    private RecordingConnection carol;

    @BeforeEach
    void setUp()
    {
        registry = new SessionRegistry();
        alice = new RecordingConnection("alice");
        bob = new RecordingConnection("bob");
        carol = new RecordingConnection("carol");
    }

    @Test
    void enqueue_keepsArrivalOrder()
    {
        assertTrue(registry.enqueue(alice));
        assertTrue(registry.enqueue(bob));
        assertFalse(registry.enqueue(alice));

        assertEquals(List.of(alice, bob), registry.getQueued());
        assertThrows(UnsupportedOperationException.class, () -> registry.getQueued().clear());
    }

    @Test
    void pairRandom_needsTwoWaiting()
    {
        registry.enqueue(alice);
        assertTrue(registry.pairRandom(new Random(1)).isEmpty());
        assertEquals(1, registry.getQueuedCount());
    }

    @Test
    void pairRandom_registersGameForBothPlayers()
    {
        registry.enqueue(alice);
        registry.enqueue(bob);
        registry.enqueue(carol);

        Game game = registry.pairRandom(new Random(7)).orElseThrow();

        assertEquals(1, registry.getQueuedCount());
        assertEquals(Optional.of(game), registry.getGame(game.getId()));
        assertEquals(List.of(game), List.copyOf(registry.getGames()));
        assertEquals(Optional.of(game), registry.findGame(game.getWhite()));
        assertEquals(Optional.of(game), registry.findGame(game.getBlack()));
        assertEquals(ConnectionState.PAIRED, registry.stateOf(game.getWhite()));
        assertEquals(ConnectionState.QUEUED, registry.stateOf(registry.getQueued().get(0)));
        assertEquals(game.getBlack(), game.opponentOf(game.getWhite()));
        assertEquals(Color.BLACK, game.colorOf(game.getBlack()));
    }

    @Test
    void removeGame_detachesBothPlayers()
    {
        Game game = registry.createGame(alice, bob, GameState.standard());

        assertTrue(registry.removeGame(game));
        assertFalse(registry.removeGame(game));

        assertTrue(registry.getGame(game.getId()).isEmpty());
        assertTrue(registry.getGames().isEmpty());
        assertEquals(ConnectionState.DETACHED, registry.stateOf(alice));
        assertEquals(ConnectionState.DETACHED, registry.stateOf(bob));
    }

    @Test
    void createGame_takesPlayersOutOfQueue()
    {
        registry.enqueue(alice);
        registry.enqueue(carol);

        Game game = registry.createGame(alice, bob, Fen.parse("4k3/8/8/8/8/8/8/4K3 b - -"));

        assertEquals(List.of(carol), registry.getQueued());
        assertEquals(Color.BLACK, game.getState().turn());
        assertThrows(IllegalStateException.class, () -> registry.createGame(carol, bob, GameState.standard()));
    }

    @Test
    void clear_returnsEveryTrackedConnection()
    {
        registry.enqueue(carol);
        registry.createGame(alice, bob, GameState.standard());

        assertEquals(List.of(carol, alice, bob), registry.clear());
        assertEquals(0, registry.getQueuedCount());
        assertEquals(0, registry.getActiveGameCount());
    }
}
