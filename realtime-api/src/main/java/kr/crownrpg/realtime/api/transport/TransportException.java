package kr.crownrpg.realtime.api.transport;

import kr.crownrpg.realtime.api.RealtimeException;

/**
 * Connect or subscribe failure of the underlying transport.
 * <p>
 * Recoverable: subscribers receive it as a non-fatal notification while the channel is retried.
 */
public class TransportException extends RealtimeException {

    private final String topic;

    public TransportException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public TransportException(String message, Throwable cause) {
        this(null, message, cause);
    }

    /**
     * Topic the failure relates to, or {@code null} for connection level failures.
     */
    public String topic() {
        return topic;
    }
}
