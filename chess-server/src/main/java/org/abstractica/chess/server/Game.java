package org.abstractica.chess.server;

import org.abstractica.chess.Color;
import org.abstractica.chess.Connection;
import org.abstractica.chess.engine.end.MoveHistory;
import org.abstractica.chess.engine.rules.GameState;

import java.util.Objects;
import java.util.Optional;

/**
 * One running game: the two players, the authoritative state, the
 * position history and any outstanding draw offer.
 *
 * <p>Owned by the tick thread.</p>
 */
public final class Game
{
    private final long id;
    private final Connection white;
    private final Connection black;
    private final GameState state;
    private final MoveHistory history;
    private Color drawOfferedBy;

    Game(long id, Connection white, Connection black)
    {
        this(id, white, black, GameState.standard());
    }

    Game(long id, Connection white, Connection black, GameState state)
    {
        this.id = id;
        this.white = Objects.requireNonNull(white, "white");
        this.black = Objects.requireNonNull(black, "black");
        this.state = Objects.requireNonNull(state, "state");
        this.history = new MoveHistory();
        if (white.getId().equals(black.getId()))
        {
            throw new IllegalArgumentException("A connection cannot play itself: " + white.getId());
        }
    }

    public long getId()
    {
        return id;
    }

    public Connection getWhite()
    {
        return white;
    }

    public Connection getBlack()
    {
        return black;
    }

    public GameState getState()
    {
        return state;
    }

    public MoveHistory getHistory()
    {
        return history;
    }

    /**
     * Returns the connection playing a color.
     *
     * @param color the color
     * @return the player's connection
     */
    public Connection connectionOf(Color color)
    {
        return color == Color.WHITE ? white : black;
    }

    /**
     * Returns the color a connection plays.
     *
     * @param connection one of the two players
     * @return its color
     * @throws IllegalArgumentException if the connection is not in this game
     */
    public Color colorOf(Connection connection)
    {
        String connectionId = connection.getId();
        if (white.getId().equals(connectionId))
        {
            return Color.WHITE;
        }
        if (black.getId().equals(connectionId))
        {
            return Color.BLACK;
        }
        throw new IllegalArgumentException("Connection " + connectionId + " is not in game " + id);
    }

    /**
     * Returns the other player.
     *
     * @param connection one of the two players
     * @return the opponent's connection
     */
    public Connection opponentOf(Connection connection)
    {
        return connectionOf(colorOf(connection).opposite());
    }

    // ========== Draw Offers ==========

    /**
     * Returns the side with an outstanding draw offer.
     *
     * @return the offering color, or empty if none
     */
    public Optional<Color> getDrawOffer()
    {
        return Optional.ofNullable(drawOfferedBy);
    }

    void offerDraw(Color color)
    {
        drawOfferedBy = Objects.requireNonNull(color, "color");
    }

    void clearDrawOffer()
    {
        drawOfferedBy = null;
    }

    @Override
    public String toString()
    {
        return "Game[" + id + ", white=" + white.getId() + ", black=" + black.getId() + "]";
    }
}
