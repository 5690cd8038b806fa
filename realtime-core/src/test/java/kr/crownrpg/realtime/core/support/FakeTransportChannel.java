package kr.crownrpg.realtime.core.support;

import kr.crownrpg.realtime.api.event.BroadcastMessage;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.event.ChangeOperation;
import kr.crownrpg.realtime.api.presence.PresenceEventType;
import kr.crownrpg.realtime.api.presence.PresenceMessage;
import kr.crownrpg.realtime.api.transport.ChannelStatusListener;
import kr.crownrpg.realtime.api.transport.SubscribeStatus;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.api.transport.TransportException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Channel of {@link FakeTransport}. Tests push inbound traffic with the {@code emit*} methods and drive the
 * subscribe outcome with {@link #confirm()} and {@link #fail(SubscribeStatus)}.
 */
public final class FakeTransportChannel implements TransportChannel {

    private final String topic;
    private final boolean autoConfirm;

    private final List<Consumer<ChangeEvent>> changeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<BroadcastMessage>> broadcastListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PresenceMessage>> presenceListeners = new CopyOnWriteArrayList<>();

    private final List<Map<String, Object>> tracked = new CopyOnWriteArrayList<>();
    private final List<BroadcastMessage> sent = new CopyOnWriteArrayList<>();

    private volatile ChannelStatusListener statusListener;
    private volatile int untrackCount;
    private volatile boolean failSends;
    private volatile boolean removed;

    FakeTransportChannel(String topic, boolean autoConfirm) {
        this.topic = topic;
        this.autoConfirm = autoConfirm;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public void onChange(Consumer<ChangeEvent> listener) {
        changeListeners.add(listener);
    }

    @Override
    public void onBroadcast(Consumer<BroadcastMessage> listener) {
        broadcastListeners.add(listener);
    }

    @Override
    public void onPresence(Consumer<PresenceMessage> listener) {
        presenceListeners.add(listener);
    }

    @Override
    public void subscribe(ChannelStatusListener statusListener) {
        this.statusListener = statusListener;
        if (autoConfirm) {
            confirm();
        }
    }

    @Override
    public void track(Map<String, Object> metadata) {
        tracked.add(metadata);
    }

    @Override
    public void untrack() {
        untrackCount++;
    }

    @Override
    public void send(BroadcastMessage message) {
        if (failSends) {
            throw new TransportException(topic, "send failed", null);
        }
        sent.add(message);
    }

    public void confirm() {
        status(SubscribeStatus.SUBSCRIBED, null);
    }

    public void fail(SubscribeStatus status) {
        status(status, new TransportException(topic, "subscribe " + status, null));
    }

    public void status(SubscribeStatus status, Throwable cause) {
        ChannelStatusListener listener = statusListener;
        if (listener == null) {
            throw new AssertionError("subscribe was not called on " + topic);
        }
        listener.onStatus(status, cause);
    }

    public void emitChange(ChangeOperation operation, String table, Map<String, Object> row) {
        Map<String, Object> before = operation == ChangeOperation.DELETE ? row : null;
        Map<String, Object> after = operation == ChangeOperation.DELETE ? null : row;
        ChangeEvent event = new ChangeEvent(topic, table, operation, before, after, Instant.now());
        changeListeners.forEach(listener -> listener.accept(event));
    }

    public void emitBroadcast(String eventName, Map<String, Object> payload) {
        BroadcastMessage message = new BroadcastMessage(topic, eventName, payload, Instant.now());
        broadcastListeners.forEach(listener -> listener.accept(message));
    }

    public void emitPresence(PresenceEventType type, List<Map<String, Object>> presences, Instant receivedAt) {
        PresenceMessage message = new PresenceMessage(topic, type, presences, receivedAt);
        presenceListeners.forEach(listener -> listener.accept(message));
    }

    public List<Map<String, Object>> tracked() {
        return new ArrayList<>(tracked);
    }

    public int trackCount() {
        return tracked.size();
    }

    public int untrackCount() {
        return untrackCount;
    }

    public List<BroadcastMessage> sent() {
        return new ArrayList<>(sent);
    }

    public void failSends(boolean failSends) {
        this.failSends = failSends;
    }

    public boolean isSubscribeRequested() {
        return statusListener != null;
    }

    void markRemoved() {
        removed = true;
    }

    public boolean isRemoved() {
        return removed;
    }
}
