package kr.crownrpg.realtime.api.cache;

import kr.crownrpg.realtime.api.RealtimeException;

/**
 * Cache miss while the network is unavailable. Never replaced by stale or empty data.
 */
public class NoCachedDataException extends RealtimeException {

    private final String key;

    public NoCachedDataException(String key) {
        super("No network connection and no cached data available for key '" + key + "'");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
