package kr.crownrpg.realtime.core.redis;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.context.RealtimeContext;

/**
 * Guards every consumer applies right after deserialization and before any side effect.
 * <pre>{@code
 * if (!envelope.environment().equals(selfEnvironment)) return;   // ignore other environments
 * if (broadcast && envelope.fromClientId().equals(selfClientId)) return; // broadcasts are not echoed
 * }</pre>
 * Change and presence messages from this client are processed so that its own presence shows up in the
 * merged peer set.
 */
public final class EnvelopeRules {

    private EnvelopeRules() {
    }

    public static boolean shouldProcess(TransportEnvelope envelope, RealtimeContext self) {
        Preconditions.checkNotNull(envelope, "envelope");
        Preconditions.checkNotNull(self, "self");
        if (!self.environment().equals(envelope.environment())) {
            return false;
        }
        if (envelope.kind() == null || envelope.event() == null) {
            return false;
        }
        return !(TransportEnvelope.KIND_BROADCAST.equals(envelope.kind())
                && self.clientId().equals(envelope.fromClientId()));
    }
}
