package kr.crownrpg.realtime.api;

/**
 * 실시간 코어에서 발생하는 모든 런타임 예외의 공통 부모.
 */
public class RealtimeException extends RuntimeException {

    public RealtimeException(String message) {
        super(message);
    }

    public RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
