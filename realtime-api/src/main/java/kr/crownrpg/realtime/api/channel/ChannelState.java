package kr.crownrpg.realtime.api.channel;

/**
 * 채널 상태 머신.
 * <pre>
 * IDLE -> SUBSCRIBING -> SUBSCRIBED
 * SUBSCRIBING | SUBSCRIBED -> RECONNECTING -> SUBSCRIBED
 * any -> UNSUBSCRIBING -> CLOSED
 * </pre>
 */
public enum ChannelState {
    IDLE,
    SUBSCRIBING,
    SUBSCRIBED,
    RECONNECTING,
    UNSUBSCRIBING,
    CLOSED;

    public boolean isOpen() {
        return this == SUBSCRIBING || this == SUBSCRIBED || this == RECONNECTING;
    }
}
