package kr.crownrpg.realtime.core.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * TransportEnvelope <-> JSON 변환만 담당.
 * (transport 에서 try/catch 덜어내기 위해 분리)
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(TransportEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode TransportEnvelope", e);
        }
    }

    public TransportEnvelope decode(String json) {
        try {
            return mapper.readValue(json, TransportEnvelope.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to decode TransportEnvelope: " + safe(json), e);
        }
    }

    private static String safe(String s) {
        if (s == null) return "null";
        if (s.length() <= 200) return s;
        return s.substring(0, 200) + "...(truncated)";
    }
}
