package kr.crownrpg.realtime.api.channel;

/**
 * Status surfaced to {@link ChannelSubscriber}s.
 */
public enum SubscriptionStatus {
    /** The channel is confirmed by the transport. */
    SUBSCRIBED,
    /** The channel or the connection failed and is being retried. */
    RECONNECTING,
    /** Retries are exhausted; the registration is kept and resumes once connectivity returns. */
    DISCONNECTED,
    /** The channel was torn down. */
    CLOSED
}
