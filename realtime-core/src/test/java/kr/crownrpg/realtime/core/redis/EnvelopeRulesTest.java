package kr.crownrpg.realtime.core.redis;

import kr.crownrpg.realtime.api.context.RealtimeContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeRulesTest {

    private static final RealtimeContext SELF = RealtimeContext.of("prod", "client-a");

    @Test
    void otherEnvironmentsAreIgnored() {
        assertThat(EnvelopeRules.shouldProcess(envelope("dev", "client-b", TransportEnvelope.KIND_CHANGE), SELF)).isFalse();
        assertThat(EnvelopeRules.shouldProcess(envelope("prod", "client-b", TransportEnvelope.KIND_CHANGE), SELF)).isTrue();
    }

    @Test
    void ownBroadcastsAreNotEchoed() {
        assertThat(EnvelopeRules.shouldProcess(envelope("prod", "client-a", TransportEnvelope.KIND_BROADCAST), SELF)).isFalse();
        assertThat(EnvelopeRules.shouldProcess(envelope("prod", "client-b", TransportEnvelope.KIND_BROADCAST), SELF)).isTrue();
    }

    @Test
    void ownPresenceIsProcessed() {
        assertThat(EnvelopeRules.shouldProcess(envelope("prod", "client-a", TransportEnvelope.KIND_PRESENCE), SELF)).isTrue();
    }

    @Test
    void envelopesWithoutKindOrEventAreIgnored() {
        assertThat(EnvelopeRules.shouldProcess(envelope("prod", "client-b", null), SELF)).isFalse();
        TransportEnvelope noEvent = new TransportEnvelope("prod", "client-b", TransportEnvelope.KIND_CHANGE, null, "t", Map.of(), 0L);
        assertThat(EnvelopeRules.shouldProcess(noEvent, SELF)).isFalse();
    }

    private static TransportEnvelope envelope(String environment, String from, String kind) {
        return new TransportEnvelope(environment, from, kind, "insert", "messages", Map.of(), 1L);
    }
}
