package kr.crownrpg.realtime.api.channel;

/**
 * 구독 핸들.
 * close() 하면 해당 구독 해제. 두 번째 호출부터는 아무 일도 하지 않는다.
 * <p>
 * Intended for try-with-resources or an owner's dispose hook so the release happens on every exit path.
 */
public interface SubscriberHandle extends AutoCloseable {

    String topic();

    boolean isActive();

    @Override
    void close();
}
