package kr.crownrpg.realtime.api.transport;

/**
 * 공유 전송 연결의 상태 머신.
 * <p>
 * {@code CONNECTED -> DISCONNECTED -> RECONNECTING -> CONNECTED}
 */
public enum ConnectionState {
    CONNECTED,
    DISCONNECTED,
    RECONNECTING
}
