package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.channel.ChannelSubscriber;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;

/**
 * Weak back-reference from the registry to a caller owned handle. Enqueued when the handle is collected
 * without having been closed.
 */
final class HandleReference extends WeakReference<DefaultSubscriberHandle> {

    final String topic;
    final long generation;
    final long id;
    final ChannelSubscriber subscriber;

    HandleReference(DefaultSubscriberHandle handle, ChannelSubscriber subscriber, ReferenceQueue<DefaultSubscriberHandle> queue) {
        super(handle, queue);
        this.topic = handle.topic();
        this.generation = handle.generation();
        this.id = handle.id();
        this.subscriber = subscriber;
    }
}
