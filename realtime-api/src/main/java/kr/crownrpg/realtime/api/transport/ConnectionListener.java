package kr.crownrpg.realtime.api.transport;

@FunctionalInterface
public interface ConnectionListener {

    /**
     * @param state new connection state reported by the transport
     * @param cause failure that caused the transition, or {@code null}
     */
    void onConnectionStateChanged(ConnectionState state, Throwable cause);
}
