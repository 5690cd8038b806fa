package kr.crownrpg.realtime.core.presence;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.presence.PresenceEntry;
import kr.crownrpg.realtime.api.presence.PresenceView;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

final class DefaultPresenceView implements PresenceView {

    private final String topic;
    private final Supplier<List<PresenceEntry>> peers;
    private final List<Consumer<List<PresenceEntry>>> listeners;

    DefaultPresenceView(String topic, Supplier<List<PresenceEntry>> peers, List<Consumer<List<PresenceEntry>>> listeners) {
        this.topic = topic;
        this.peers = peers;
        this.listeners = listeners;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public List<PresenceEntry> peers() {
        return peers.get();
    }

    @Override
    public boolean contains(String peerId) {
        for (PresenceEntry entry : peers.get()) {
            if (entry.peerId().equals(peerId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void addListener(Consumer<List<PresenceEntry>> listener) {
        listeners.add(Preconditions.checkNotNull(listener, "listener"));
    }

    @Override
    public void removeListener(Consumer<List<PresenceEntry>> listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return "PresenceView{" + topic + "}";
    }
}
