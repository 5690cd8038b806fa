package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.channel.ChannelSnapshot;
import kr.crownrpg.realtime.api.channel.ChannelState;
import kr.crownrpg.realtime.api.transport.TransportChannel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry bookkeeping for one topic. Guarded by the registry lock.
 */
final class ManagedChannel {

    final String topic;
    final long generation;
    final Map<Long, HandleReference> handles = new LinkedHashMap<>();

    ChannelState state = ChannelState.IDLE;
    TransportChannel transportChannel;
    // retries gave up; cleared when a new recovery round starts
    boolean disconnected;

    ManagedChannel(String topic, long generation) {
        this.topic = topic;
        this.generation = generation;
    }

    int refCount() {
        return handles.size();
    }

    List<HandleReference> handleRefs() {
        return new ArrayList<>(handles.values());
    }

    ChannelSnapshot snapshot() {
        return new ChannelSnapshot(topic, state, handles.size(), generation);
    }
}
