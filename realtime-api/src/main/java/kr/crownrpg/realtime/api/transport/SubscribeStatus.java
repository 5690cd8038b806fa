package kr.crownrpg.realtime.api.transport;

/**
 * Status values reported by {@link TransportChannel#subscribe(ChannelStatusListener)}.
 */
public enum SubscribeStatus {
    SUBSCRIBED,
    CHANNEL_ERROR,
    TIMED_OUT,
    CLOSED;

    public boolean isFailure() {
        return this == CHANNEL_ERROR || this == TIMED_OUT;
    }
}
