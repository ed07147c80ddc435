package org.abstractica.chess.server;

import org.abstractica.chess.Color;
import org.abstractica.chess.Connection;
import org.abstractica.chess.DisconnectReason;
import org.abstractica.chess.EndReason;
import org.abstractica.chess.GameOutcome;
import org.abstractica.chess.GameServer;
import org.abstractica.chess.ServerStats;
import org.abstractica.chess.engine.end.GameEndDetector;
import org.abstractica.chess.engine.rules.GameState;
import org.abstractica.chess.engine.rules.InvalidMoveException;
import org.abstractica.chess.engine.rules.InvalidPromotionException;
import org.abstractica.chess.handlers.CommandHandler;
import org.abstractica.chess.handlers.ErrorHandler;
import org.abstractica.chess.protocol.ClientMessage;
import org.abstractica.chess.protocol.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the GameServer interface.
 *
 * <p>Transport threads queue events; a single tick thread handles them one
 * at a time, so game state is never touched concurrently. Each tick
 * drains up to {@code maxEventsPerTick} events and then pairs waiting
 * connections while at least two are queued.</p>
 *
 * <p>A command handler that throws marks a broken invariant: the affected
 * game is torn down, both players are disconnected and the registered
 * {@link ErrorHandler} is notified. A failure to send to a client is
 * logged and otherwise ignored.</p>
 */
public class DefaultGameServer implements GameServer
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultGameServer.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final SessionRegistry registry;
    private final BlockingQueue<ServerEvent> events;
    private final Random random;
    private final Duration tickInterval;
    private final int maxEventsPerTick;
    private final Map<Class<?>, CommandHandler<?>> commandHandlers;
    private final DefaultServerStats stats;
    private volatile ErrorHandler errorHandler;

    private Thread tickThread;
    private volatile boolean running;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultGameServerFactory} to create instances.</p>
     */
    DefaultGameServer(Random random, Duration tickInterval, int maxEventsPerTick, int eventQueueCapacity)
    {
        this.random = Objects.requireNonNull(random, "random");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.maxEventsPerTick = maxEventsPerTick;

        this.registry = new SessionRegistry();
        this.events = new LinkedBlockingQueue<>(eventQueueCapacity);
        this.stats = new DefaultServerStats();
        this.commandHandlers = new ConcurrentHashMap<>();
        this.running = false;

        onCommand(ClientMessage.Move.class, this::handleMove);
        onCommand(ClientMessage.Promote.class, this::handlePromote);
        onCommand(ClientMessage.RequestDraw.class, this::handleRequestDraw);
        onCommand(ClientMessage.Reconnect.class, this::handleReconnect);
        onCommand(ClientMessage.Resign.class, this::handleResign);
    }

    // ========== GameServer Interface ==========

    @Override
    public synchronized void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting server (tick interval {} ms, max {} events per tick)",
                tickInterval.toMillis(), maxEventsPerTick);

        running = true;
        tickThread = new Thread(this::tickLoop, "chess-server-tick");
        tickThread.setDaemon(true);
        tickThread.start();

        LOG.info("Server started");
    }

    @Override
    public synchronized void close()
    {
        LOG.info("Closing server");

        running = false;
        if (tickThread != null)
        {
            tickThread.interrupt();
            try
            {
                tickThread.join(SHUTDOWN_WAIT.toMillis());
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
            if (tickThread.isAlive())
            {
                LOG.error("Tick thread did not stop within {} ms, leaving sessions in place",
                        SHUTDOWN_WAIT.toMillis());
                return;
            }
            tickThread = null;
        }

        List<ServerEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        for (ServerEvent event : pending)
        {
            if (event instanceof ServerEvent.Connected)
            {
                safeDisconnect(event.connection());
            }
        }
        for (Connection connection : registry.clear())
        {
            safeDisconnect(connection);
        }
        stats.publish(registry);

        LOG.info("Server closed");
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the tick thread is running
     */
    @Override
    public synchronized int tick()
    {
        if (tickThread != null)
        {
            throw new IllegalStateException("Tick thread is running");
        }
        return runTick(null);
    }

    @Override
    public void connected(Connection connection)
    {
        enqueue(new ServerEvent.Connected(connection));
    }

    @Override
    public void received(Connection connection, ClientMessage message)
    {
        enqueue(new ServerEvent.Received(connection, message));
    }

    @Override
    public void disconnected(Connection connection, DisconnectReason reason)
    {
        enqueue(new ServerEvent.Disconnected(connection, reason));
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    SessionRegistry getRegistry()
    {
        return registry;
    }

    private <T extends ClientMessage> void onCommand(Class<T> type, CommandHandler<T> handler)
    {
        commandHandlers.put(type, handler);
    }

    private void enqueue(ServerEvent event)
    {
        if (events.offer(event))
        {
            return;
        }
        LOG.warn("Event queue full, dropping {} from {}",
                event.getClass().getSimpleName(), event.connection().getId());
        if (event instanceof ServerEvent.Connected)
        {
            safeDisconnect(event.connection());
        }
    }

    // ========== Tick Loop ==========

    private void tickLoop()
    {
        LOG.debug("Tick loop started");

        while (running)
        {
            try
            {
                ServerEvent first = events.poll(tickInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (!running)
                {
                    break;
                }
                runTick(first);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (Exception e)
            {
                LOG.error("Error in tick loop", e);
            }
        }

        LOG.debug("Tick loop stopped");
    }

    private int runTick(ServerEvent first)
    {
        int handled = 0;
        ServerEvent event = first != null ? first : events.poll();
        while (event != null)
        {
            handle(event);
            handled++;
            if (handled >= maxEventsPerTick)
            {
                break;
            }
            event = events.poll();
        }

        pairWaiting();
        stats.publish(registry);
        return handled;
    }

    private void handle(ServerEvent event)
    {
        try
        {
            if (event instanceof ServerEvent.Connected connected)
            {
                handleConnected(connected.connection());
            }
            else if (event instanceof ServerEvent.Received received)
            {
                dispatch(received.connection(), received.message());
            }
            else if (event instanceof ServerEvent.Disconnected disconnected)
            {
                handleDisconnected(disconnected.connection(), disconnected.reason());
            }
        }
        catch (Exception e)
        {
            LOG.error("Error handling {} from {}", event.getClass().getSimpleName(),
                    event.connection().getId(), e);
        }
    }

    // ========== Connection Lifecycle ==========

    private void handleConnected(Connection connection)
    {
        if (!registry.enqueue(connection))
        {
            LOG.warn("Ignoring duplicate connect from {} ({})", connection.getId(), registry.stateOf(connection));
            return;
        }
        LOG.info("Connection {} queued ({} waiting)", connection.getId(), registry.getQueuedCount());
    }

    private void handleDisconnected(Connection connection, DisconnectReason reason)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isPresent())
        {
            Game game = found.get();
            Connection opponent = game.opponentOf(connection);
            LOG.info("Connection {} left {} ({}), {} wins",
                    connection.getId(), game, describe(reason), game.colorOf(opponent));
            finish(game, GameOutcome.win(game.colorOf(opponent), EndReason.RESIGNATION), opponent);
            return;
        }
        if (registry.removeFromQueue(connection))
        {
            LOG.info("Connection {} left the queue ({})", connection.getId(), describe(reason));
            return;
        }
        LOG.debug("Disconnect from untracked connection {}", connection.getId());
    }

    private void pairWaiting()
    {
        while (registry.getQueuedCount() >= 2)
        {
            Game game = registry.pairRandom(random).orElseThrow();
            LOG.info("Game {} started: white={}, black={}",
                    game.getId(), game.getWhite().getId(), game.getBlack().getId());
            safeSend(game.getWhite(), new ServerMessage.MatchFound(Color.WHITE));
            safeSend(game.getBlack(), new ServerMessage.MatchFound(Color.BLACK));
        }
    }

    // ========== Command Dispatch ==========

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void dispatch(Connection connection, ClientMessage message)
    {
        CommandHandler handler = commandHandlers.get(message.getClass());
        if (handler == null)
        {
            LOG.debug("No handler for command type: {}", message.getClass().getName());
            return;
        }

        try
        {
            handler.handle(connection, message);
        }
        catch (Exception e)
        {
            handleCommandFailure(connection, message, e);
        }
    }

    private void handleCommandFailure(Connection connection, ClientMessage message, Exception exception)
    {
        LOG.error("Command {} from {} failed, tearing down its game", message, connection.getId(), exception);

        Optional<Game> found = registry.findGame(connection);
        if (found.isPresent())
        {
            Game game = found.get();
            registry.removeGame(game);
            safeDisconnect(game.getWhite());
            safeDisconnect(game.getBlack());
        }
        else
        {
            registry.removeFromQueue(connection);
            safeDisconnect(connection);
        }

        ErrorHandler handler = errorHandler;
        if (handler != null)
        {
            try
            {
                handler.handle(connection, message, exception);
            }
            catch (Exception e)
            {
                LOG.error("Error handler threw", e);
            }
        }
    }

    // ========== Command Handlers ==========

    private void handleMove(Connection connection, ClientMessage.Move command)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isEmpty())
        {
            LOG.debug("Dropping move from {}: not in a game", connection.getId());
            return;
        }

        Game game = found.get();
        GameState state = game.getState();
        Color color = game.colorOf(connection);
        if (state.turn() != color || state.isPromotionPending())
        {
            LOG.debug("Rejecting {} from {} in game {}: not their turn", command, color, game.getId());
            reject(game, connection);
            return;
        }

        try
        {
            state.applyMove(command.toChessMove());
        }
        catch (InvalidMoveException e)
        {
            LOG.debug("Rejecting {} from {} in game {}: {}", command, color, game.getId(), e.getMessage());
            reject(game, connection);
            return;
        }

        stats.recordMoveApplied();
        game.clearDrawOffer();
        safeSend(game.opponentOf(connection), new ServerMessage.MoveApplied(command.from(), command.to()));

        if (state.isPromotionPending())
        {
            LOG.debug("Game {} waiting for {} to promote on {}",
                    game.getId(), color, state.promotionSquare().orElseThrow());
            return;
        }
        completeTurn(game);
    }

    private void handlePromote(Connection connection, ClientMessage.Promote command)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isEmpty())
        {
            LOG.debug("Dropping promotion from {}: not in a game", connection.getId());
            return;
        }

        Game game = found.get();
        GameState state = game.getState();
        Color color = game.colorOf(connection);
        if (!state.promotingColor().equals(Optional.of(color)))
        {
            LOG.debug("Rejecting promotion from {} in game {}: no promotion of theirs pending", color, game.getId());
            reject(game, connection);
            return;
        }

        try
        {
            state.promote(command.kind());
        }
        catch (InvalidPromotionException e)
        {
            LOG.debug("Rejecting promotion from {} in game {}: {}", color, game.getId(), e.getMessage());
            reject(game, connection);
            return;
        }

        safeSend(game.opponentOf(connection), new ServerMessage.PromotionApplied(command.kind()));
        completeTurn(game);
    }

    private void handleRequestDraw(Connection connection, ClientMessage.RequestDraw command)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isEmpty())
        {
            LOG.debug("Dropping draw request from {}: not in a game", connection.getId());
            return;
        }

        Game game = found.get();
        Color color = game.colorOf(connection);
        Optional<Color> offer = game.getDrawOffer();
        if (offer.isEmpty())
        {
            game.offerDraw(color);
            LOG.debug("{} offers a draw in game {}", color, game.getId());
            safeSend(game.opponentOf(connection), new ServerMessage.DrawOffered());
        }
        else if (offer.get() == color)
        {
            LOG.debug("Ignoring repeated draw offer from {} in game {}", color, game.getId());
        }
        else
        {
            finish(game, GameOutcome.draw(EndReason.AGREEMENT), game.getWhite(), game.getBlack());
        }
    }

    private void handleReconnect(Connection connection, ClientMessage.Reconnect command)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isEmpty())
        {
            LOG.info("Reconnect from {} without a game, dropping connection", connection.getId());
            registry.removeFromQueue(connection);
            safeDisconnect(connection);
            return;
        }

        Game game = found.get();
        LOG.debug("Resending state of game {} to {}", game.getId(), connection.getId());
        safeSend(connection, new ServerMessage.StateSnapshot(game.getState().snapshot()));
    }

    private void handleResign(Connection connection, ClientMessage.Resign command)
    {
        Optional<Game> found = registry.findGame(connection);
        if (found.isEmpty())
        {
            LOG.debug("Dropping resignation from {}: not in a game", connection.getId());
            return;
        }

        Game game = found.get();
        Color winner = game.colorOf(connection).opposite();
        finish(game, GameOutcome.win(winner, EndReason.RESIGNATION), game.getWhite(), game.getBlack());
    }

    // ========== Game Flow ==========

    private void completeTurn(Game game)
    {
        GameState state = game.getState();
        game.getHistory().record(state.compactBoard());
        GameEndDetector.detect(state, game.getHistory())
                .ifPresent(outcome -> finish(game, outcome, game.getWhite(), game.getBlack()));
    }

    private void reject(Game game, Connection connection)
    {
        stats.recordMoveRejected();
        safeSend(connection, new ServerMessage.StateSnapshot(game.getState().snapshot()));
    }

    private void finish(Game game, GameOutcome outcome, Connection... recipients)
    {
        registry.removeGame(game);
        stats.recordGameFinished();
        LOG.info("Game {} ended: {} by {}", game.getId(), outcome.result(), outcome.reason());

        ServerMessage.GameEnded ended = ServerMessage.GameEnded.of(outcome);
        for (Connection recipient : recipients)
        {
            safeSend(recipient, ended);
        }
        safeDisconnect(game.getWhite());
        safeDisconnect(game.getBlack());
    }

    // ========== Outbound ==========

    private void safeSend(Connection connection, ServerMessage message)
    {
        try
        {
            connection.send(message);
        }
        catch (Exception e)
        {
            LOG.warn("Failed to send {} to {}: {}", message.getClass().getSimpleName(),
                    connection.getId(), e.getMessage());
        }
    }

    private void safeDisconnect(Connection connection)
    {
        try
        {
            connection.disconnect();
        }
        catch (Exception e)
        {
            LOG.warn("Failed to disconnect {}: {}", connection.getId(), e.getMessage());
        }
    }

    private static String describe(DisconnectReason reason)
    {
        if (reason instanceof DisconnectReason.NetworkError networkError)
        {
            return "network error: " + networkError.cause().getMessage();
        }
        if (reason instanceof DisconnectReason.Timeout)
        {
            return "timeout";
        }
        if (reason instanceof DisconnectReason.ClosedByClient)
        {
            return "closed by client";
        }
        return "server shutdown";
    }
}
