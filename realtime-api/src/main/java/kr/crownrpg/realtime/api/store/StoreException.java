package kr.crownrpg.realtime.api.store;

import kr.crownrpg.realtime.api.RealtimeException;

public class StoreException extends RealtimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
