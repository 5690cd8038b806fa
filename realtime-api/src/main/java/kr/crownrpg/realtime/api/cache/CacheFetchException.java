package kr.crownrpg.realtime.api.cache;

import kr.crownrpg.realtime.api.RealtimeException;

/**
 * Wraps a checked failure thrown by a {@link Fetcher}. Unchecked failures propagate unwrapped.
 */
public class CacheFetchException extends RealtimeException {

    public CacheFetchException(String key, Throwable cause) {
        super("Fetch failed for cache key '" + key + "'", cause);
    }
}
