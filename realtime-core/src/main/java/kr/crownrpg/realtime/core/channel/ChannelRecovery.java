package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.transport.TransportException;

/**
 * Receives per-channel failure and recovery events from the registry. Called outside the registry lock.
 */
public interface ChannelRecovery {

    ChannelRecovery NONE = new ChannelRecovery() {
    };

    default void channelFailed(String topic, TransportException error) {
    }

    default void channelRecovered(String topic) {
    }

    /**
     * The channel was torn down; pending retries for the topic must be dropped.
     */
    default void channelClosed(String topic) {
    }
}
