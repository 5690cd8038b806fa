package kr.crownrpg.realtime.api.transport;

@FunctionalInterface
public interface ChannelStatusListener {

    void onStatus(SubscribeStatus status, Throwable cause);
}
