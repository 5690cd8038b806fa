package kr.crownrpg.realtime.api.event;

/**
 * 리스너 등록 핸들. close() 하면 등록 해제.
 */
public interface ListenerRegistration extends AutoCloseable {

    String topic();

    boolean isActive();

    @Override
    void close();
}
