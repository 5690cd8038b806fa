package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.channel.SubscriberHandle;

import java.util.concurrent.atomic.AtomicBoolean;

final class DefaultSubscriberHandle implements SubscriberHandle {

    private final DefaultChannelRegistry registry;
    private final String topic;
    private final long generation;
    private final long id;
    private final AtomicBoolean released = new AtomicBoolean(false);

    DefaultSubscriberHandle(DefaultChannelRegistry registry, String topic, long generation, long id) {
        this.registry = registry;
        this.topic = topic;
        this.generation = generation;
        this.id = id;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public boolean isActive() {
        return !released.get();
    }

    @Override
    public void close() {
        registry.unsubscribe(this);
    }

    DefaultChannelRegistry registry() {
        return registry;
    }

    long generation() {
        return generation;
    }

    long id() {
        return id;
    }

    /**
     * @return {@code true} only for the first call
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "SubscriberHandle{topic=" + topic + ", generation=" + generation + ", id=" + id
                + ", active=" + isActive() + "}";
    }
}
