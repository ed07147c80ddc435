package org.abstractica.chess.server;

import org.abstractica.chess.Connection;
import org.abstractica.chess.protocol.ServerMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connection double that records everything the server sends.
 */
class RecordingConnection implements Connection
{
    private final String id;
    private final List<ServerMessage> sent = new CopyOnWriteArrayList<>();
    private volatile boolean disconnected;
    private volatile boolean failSends;

    RecordingConnection(String id)
    {
        this.id = id;
    }

    @Override
    public String getId()
    {
        return id;
    }

    @Override
    public void send(ServerMessage message)
    {
        if (failSends)
        {
            throw new IllegalStateException("Send failed for " + id);
        }
        sent.add(message);
    }

    @Override
    public void disconnect()
    {
        disconnected = true;
    }

    void failSends()
    {
        failSends = true;
    }

    boolean isDisconnected()
    {
        return disconnected;
    }

    List<ServerMessage> sent()
    {
        return new ArrayList<>(sent);
    }

    /**
     * Returns and forgets everything sent so far.
     */
    List<ServerMessage> drain()
    {
        List<ServerMessage> copy = new ArrayList<>(sent);
        sent.removeAll(copy);
        return copy;
    }

    <T extends ServerMessage> List<T> sentOfType(Class<T> type)
    {
        List<T> matching = new ArrayList<>();
        for (ServerMessage message : sent)
        {
            if (type.isInstance(message))
            {
                matching.add(type.cast(message));
            }
        }
        return matching;
    }

    @Override
    public String toString()
    {
        return "RecordingConnection[" + id + "]";
    }
}
