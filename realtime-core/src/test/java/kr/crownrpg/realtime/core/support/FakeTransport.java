package kr.crownrpg.realtime.core.support;

import kr.crownrpg.realtime.api.transport.ConnectionListener;
import kr.crownrpg.realtime.api.transport.ConnectionState;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.api.transport.TransportException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport. Connects synchronously; every opened channel is recorded for inspection.
 */
public final class FakeTransport implements RealtimeTransport {

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<FakeTransportChannel> opened = new CopyOnWriteArrayList<>();
    private final List<FakeTransportChannel> removed = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile int failConnects;
    private volatile int connectAttempts;
    private volatile boolean autoConfirm = true;
    private volatile boolean failChannelCreation;

    public FakeTransport failNextConnects(int count) {
        this.failConnects = count;
        return this;
    }

    public FakeTransport failChannelCreation(boolean fail) {
        this.failChannelCreation = fail;
        return this;
    }

    public FakeTransport autoConfirm(boolean autoConfirm) {
        this.autoConfirm = autoConfirm;
        return this;
    }

    @Override
    public synchronized CompletableFuture<Void> connect() {
        connectAttempts++;
        if (failConnects > 0) {
            failConnects--;
            return CompletableFuture.failedFuture(new TransportException("connection refused", null));
        }
        setState(ConnectionState.CONNECTED, null);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void disconnect() {
        setState(ConnectionState.DISCONNECTED, null);
    }

    /**
     * Simulates the server dropping the shared connection.
     */
    public void dropConnection() {
        setState(ConnectionState.DISCONNECTED, new TransportException("connection reset", null));
    }

    @Override
    public ConnectionState connectionState() {
        return state;
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeConnectionListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public TransportChannel channel(String topic) {
        if (failChannelCreation) {
            throw new TransportException(topic, "channel creation refused", null);
        }
        FakeTransportChannel channel = new FakeTransportChannel(topic, autoConfirm && state == ConnectionState.CONNECTED);
        opened.add(channel);
        return channel;
    }

    @Override
    public void removeChannel(TransportChannel channel) {
        if (channel instanceof FakeTransportChannel fake) {
            fake.markRemoved();
            removed.add(fake);
        }
    }

    public int connectAttempts() {
        return connectAttempts;
    }

    public int listenerCount() {
        return listeners.size();
    }

    public List<FakeTransportChannel> opened() {
        return new ArrayList<>(opened);
    }

    public List<FakeTransportChannel> removed() {
        return new ArrayList<>(removed);
    }

    public int openedCount(String topic) {
        return (int) opened.stream().filter(c -> c.topic().equals(topic)).count();
    }

    /**
     * Most recently opened channel of the topic.
     */
    public FakeTransportChannel last(String topic) {
        FakeTransportChannel last = null;
        for (FakeTransportChannel channel : opened) {
            if (channel.topic().equals(topic)) {
                last = channel;
            }
        }
        if (last == null) {
            throw new AssertionError("no channel opened for " + topic);
        }
        return last;
    }

    private void setState(ConnectionState newState, Throwable cause) {
        if (state == newState) {
            return;
        }
        state = newState;
        for (ConnectionListener listener : listeners) {
            listener.onConnectionStateChanged(newState, cause);
        }
    }
}
