package kr.crownrpg.realtime.api.presence;

import java.util.List;
import java.util.function.Consumer;

/**
 * Live presence set of a topic. Reads always reflect the latest merge with stale peers excluded.
 */
public interface PresenceView {

    String topic();

    List<PresenceEntry> peers();

    boolean contains(String peerId);

    /**
     * Registers a listener that receives the pruned peer list after every applied presence message.
     * Listeners are dropped when the topic's channel is torn down.
     */
    void addListener(Consumer<List<PresenceEntry>> listener);

    void removeListener(Consumer<List<PresenceEntry>> listener);
}
