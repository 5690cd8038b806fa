package kr.crownrpg.realtime.api.channel;

import java.util.Optional;
import java.util.Set;

/**
 * Owns the topic to channel mapping and reference counts subscriptions.
 * <p>
 * The underlying transport channel is opened on the 0 to 1 transition of a topic's reference count and released
 * on the 1 to 0 transition. Mutations are serialized; callers may invoke them concurrently.
 */
public interface ChannelRegistry {

    SubscriberHandle subscribe(String topic, ChannelSubscriber subscriber);

    default SubscriberHandle subscribe(String topic) {
        return subscribe(topic, ChannelSubscriber.NOOP);
    }

    /**
     * @return {@code true} if this call released the handle, {@code false} if it was already released
     */
    boolean unsubscribe(SubscriberHandle handle);

    Optional<ChannelSnapshot> snapshot(String topic);

    Set<String> activeTopics();

    /**
     * Tears down every channel regardless of reference counts. Outstanding handles become inactive.
     */
    void closeAll();
}
