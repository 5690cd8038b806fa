package kr.crownrpg.realtime.api.context;

import kr.crownrpg.realtime.api.Preconditions;

/**
 * 환경 이름과 클라이언트 식별자를 보관하는 변경 불가 컨텍스트.
 * <p>
 * 클라이언트 식별자는 presence 에서 자신의 peerId 로, 전송 계층에서는 발신자 식별에 쓰인다.
 */
public record RealtimeContext(String environment, String clientId) {

    public RealtimeContext {
        Preconditions.checkNotBlank(environment, "environment");
        Preconditions.checkNotBlank(clientId, "clientId");
    }

    public static RealtimeContext of(String environment, String clientId) {
        return new RealtimeContext(environment, clientId);
    }
}
