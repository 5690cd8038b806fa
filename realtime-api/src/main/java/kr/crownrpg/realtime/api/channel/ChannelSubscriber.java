package kr.crownrpg.realtime.api.channel;

import kr.crownrpg.realtime.api.transport.TransportException;

/**
 * Receives lifecycle notifications for one subscription. Both methods default to no-ops.
 */
public interface ChannelSubscriber {

    ChannelSubscriber NOOP = new ChannelSubscriber() {
    };

    default void onStatus(String topic, SubscriptionStatus status) {
    }

    /**
     * Non-fatal transport failure; the subscription stays registered.
     */
    default void onError(String topic, TransportException error) {
    }
}
