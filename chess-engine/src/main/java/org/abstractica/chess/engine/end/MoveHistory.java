package org.abstractica.chess.engine.end;

import org.abstractica.chess.engine.board.CompactBoard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compacted board after every completed move of a game, oldest first.
 *
 * <p>Used for repetition detection only. Grows for the life of the game
 * and is discarded with it.</p>
 */
public final class MoveHistory
{
    private final List<CompactBoard> positions = new ArrayList<>();

    /**
     * Appends the position reached by a completed move.
     *
     * @param position the compacted board
     */
    public void record(CompactBoard position)
    {
        positions.add(Objects.requireNonNull(position, "position"));
    }

    /**
     * Counts how often a position occurs in the history.
     *
     * @param position the compacted board
     * @return number of occurrences
     */
    public int occurrences(CompactBoard position)
    {
        Objects.requireNonNull(position, "position");
        int count = 0;
        for (CompactBoard recorded : positions)
        {
            if (recorded.equals(position))
            {
                count++;
            }
        }
        return count;
    }

    public int size()
    {
        return positions.size();
    }

    public List<CompactBoard> positions()
    {
        return Collections.unmodifiableList(positions);
    }
}
