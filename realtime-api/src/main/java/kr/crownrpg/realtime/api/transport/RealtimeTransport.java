package kr.crownrpg.realtime.api.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Real-time backend connection shared by every topic of the process.
 * <p>
 * The transport does not reconnect on its own; reconnection is driven by the caller.
 */
public interface RealtimeTransport {

    /**
     * 연결을 시도한다. 실패 시 future 가 {@link TransportException} 으로 완료된다.
     */
    CompletableFuture<Void> connect();

    void disconnect();

    ConnectionState connectionState();

    default boolean isConnected() {
        return connectionState() == ConnectionState.CONNECTED;
    }

    void addConnectionListener(ConnectionListener listener);

    void removeConnectionListener(ConnectionListener listener);

    TransportChannel channel(String topic);

    void removeChannel(TransportChannel channel);
}
