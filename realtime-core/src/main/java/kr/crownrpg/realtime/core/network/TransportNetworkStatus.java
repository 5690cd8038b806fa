package kr.crownrpg.realtime.core.network;

import kr.crownrpg.realtime.api.network.NetworkStatus;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;

import java.util.Objects;

/**
 * Reports connectivity as the state of the shared realtime connection.
 */
public final class TransportNetworkStatus implements NetworkStatus {

    private final RealtimeTransport transport;

    public TransportNetworkStatus(RealtimeTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public boolean isConnected() {
        return transport.isConnected();
    }
}
