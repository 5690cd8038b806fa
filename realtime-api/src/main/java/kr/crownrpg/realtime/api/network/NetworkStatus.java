package kr.crownrpg.realtime.api.network;

/**
 * Connectivity check consulted only to decide whether a cache miss may go to the network.
 */
@FunctionalInterface
public interface NetworkStatus {

    NetworkStatus ALWAYS_CONNECTED = () -> true;

    boolean isConnected();
}
