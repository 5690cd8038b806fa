package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.channel.ChannelSnapshot;
import kr.crownrpg.realtime.api.channel.ChannelState;
import kr.crownrpg.realtime.api.channel.SubscriberHandle;
import kr.crownrpg.realtime.api.channel.SubscriptionStatus;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.event.ChangeFilter;
import kr.crownrpg.realtime.api.event.ChangeOperation;
import kr.crownrpg.realtime.api.transport.SubscribeStatus;
import kr.crownrpg.realtime.api.transport.TransportException;
import kr.crownrpg.realtime.core.event.DefaultEventStream;
import kr.crownrpg.realtime.core.event.EventStreamSettings;
import kr.crownrpg.realtime.core.presence.DefaultPresenceTracker;
import kr.crownrpg.realtime.core.presence.PresenceSettings;
import kr.crownrpg.realtime.core.support.FakeTransport;
import kr.crownrpg.realtime.core.support.FakeTransportChannel;
import kr.crownrpg.realtime.core.support.ManualTaskScheduler;
import kr.crownrpg.realtime.core.support.MutableClock;
import kr.crownrpg.realtime.core.support.RecordingSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultChannelRegistryTest {

    private static final String TOPIC = "chat-123";

    private FakeTransport transport;
    private DefaultEventStream events;
    private DefaultPresenceTracker presence;
    private DefaultChannelRegistry registry;
    // handles are referenced weakly by the registry
    private final List<SubscriberHandle> held = new ArrayList<>();

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        transport = new FakeTransport();
        transport.connect().join();
        events = new DefaultEventStream(Runnable::run, EventStreamSettings.defaults());
        presence = new DefaultPresenceTracker(new ManualTaskScheduler(clock), clock, PresenceSettings.defaults());
        registry = new DefaultChannelRegistry(transport, events, presence);
    }

    @Test
    void channelOpensOnFirstSubscribeAndClosesOnLastRelease() {
        SubscriberHandle first = registry.subscribe(TOPIC);
        SubscriberHandle second = registry.subscribe(TOPIC);

        assertThat(transport.openedCount(TOPIC)).isEqualTo(1);
        assertThat(registry.snapshot(TOPIC).orElseThrow().refCount()).isEqualTo(2);

        first.close();
        assertThat(registry.snapshot(TOPIC).orElseThrow().refCount()).isEqualTo(1);
        assertThat(transport.last(TOPIC).isRemoved()).isFalse();

        second.close();
        assertThat(registry.snapshot(TOPIC)).isEmpty();
        assertThat(registry.activeTopics()).isEmpty();
        assertThat(transport.last(TOPIC).isRemoved()).isTrue();
        assertThat(transport.openedCount(TOPIC)).isEqualTo(1);
    }

    @Test
    void releasingHandleTwiceIsNoop() {
        SubscriberHandle handle = registry.subscribe(TOPIC);

        assertThat(registry.unsubscribe(handle)).isTrue();
        assertThat(registry.unsubscribe(handle)).isFalse();
        handle.close();

        assertThat(handle.isActive()).isFalse();
        assertThat(transport.removed()).hasSize(1);
    }

    @Test
    @Timeout(10)
    void concurrentSubscribesOpenOneChannel() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SubscriberHandle>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.subscribe(TOPIC);
                }));
            }
            start.countDown();
            List<SubscriberHandle> handles = new ArrayList<>();
            for (Future<SubscriberHandle> future : futures) {
                handles.add(future.get(5, TimeUnit.SECONDS));
            }

            assertThat(transport.openedCount(TOPIC)).isEqualTo(1);
            assertThat(registry.snapshot(TOPIC).orElseThrow().refCount()).isEqualTo(threads);

            handles.forEach(SubscriberHandle::close);
            assertThat(registry.snapshot(TOPIC)).isEmpty();
            assertThat(transport.removed()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void subscribersAreToldWhenChannelIsConfirmed() {
        transport.autoConfirm(false);
        RecordingSubscriber early = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, early));
        assertThat(registry.snapshot(TOPIC).orElseThrow().state()).isEqualTo(ChannelState.SUBSCRIBING);

        transport.last(TOPIC).confirm();
        RecordingSubscriber late = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, late));

        assertThat(early.statuses()).containsExactly(SubscriptionStatus.SUBSCRIBED);
        assertThat(late.statuses()).containsExactly(SubscriptionStatus.SUBSCRIBED);
    }

    @Test
    void subscribeFailureIsReportedAsNonFatal() {
        transport.autoConfirm(false);
        RecordingSubscriber subscriber = new RecordingSubscriber();
        SubscriberHandle handle = registry.subscribe(TOPIC, subscriber);

        transport.last(TOPIC).fail(SubscribeStatus.CHANNEL_ERROR);

        assertThat(subscriber.errors()).hasSize(1);
        assertThat(subscriber.errors().get(0).topic()).isEqualTo(TOPIC);
        assertThat(subscriber.lastStatus()).isEqualTo(SubscriptionStatus.RECONNECTING);
        ChannelSnapshot snapshot = registry.snapshot(TOPIC).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(ChannelState.RECONNECTING);
        assertThat(snapshot.refCount()).isEqualTo(1);
        assertThat(handle.isActive()).isTrue();
    }

    @Test
    void lateSubscriberOfFailedChannelLearnsItsStatus() {
        transport.autoConfirm(false);
        RecordingSubscriber first = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, first));
        transport.last(TOPIC).fail(SubscribeStatus.CHANNEL_ERROR);

        RecordingSubscriber whileRetrying = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, whileRetrying));
        assertThat(whileRetrying.statuses()).containsExactly(SubscriptionStatus.RECONNECTING);
        assertThat(whileRetrying.errors()).isEmpty();

        registry.notifyDisconnected(TOPIC);
        RecordingSubscriber afterGivingUp = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, afterGivingUp));
        assertThat(afterGivingUp.statuses()).containsExactly(SubscriptionStatus.DISCONNECTED);

        assertThat(registry.reopen(TOPIC)).isTrue();
        transport.last(TOPIC).confirm();
        RecordingSubscriber afterRecovery = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, afterRecovery));

        assertThat(afterRecovery.statuses()).containsExactly(SubscriptionStatus.SUBSCRIBED);
        assertThat(afterGivingUp.statuses()).containsExactly(SubscriptionStatus.DISCONNECTED, SubscriptionStatus.SUBSCRIBED);
        assertThat(transport.openedCount(TOPIC)).isEqualTo(2);
    }

    @Test
    void presenceCanBeTrackedWhileChannelCreationFails() {
        transport.failChannelCreation(true);
        RecordingSubscriber subscriber = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, subscriber));

        assertThat(registry.snapshot(TOPIC).orElseThrow().state()).isEqualTo(ChannelState.RECONNECTING);
        assertThat(transport.openedCount(TOPIC)).isZero();

        presence.track(TOPIC, Map.of("name", "kim"));
        assertThat(presence.isTracking(TOPIC)).isTrue();

        transport.failChannelCreation(false);
        assertThat(registry.reopen(TOPIC)).isTrue();

        assertThat(registry.snapshot(TOPIC).orElseThrow().state()).isEqualTo(ChannelState.SUBSCRIBED);
        assertThat(transport.last(TOPIC).trackCount()).isEqualTo(1);
        assertThat(subscriber.statuses()).containsExactly(SubscriptionStatus.RECONNECTING, SubscriptionStatus.SUBSCRIBED);
    }

    @Test
    void subscriberJoiningDuringConnectionOutageIsToldReconnecting() {
        held.add(registry.subscribe(TOPIC));
        registry.markReconnecting();

        RecordingSubscriber late = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, late));
        assertThat(late.statuses()).containsExactly(SubscriptionStatus.RECONNECTING);

        registry.notifyDisconnected();
        RecordingSubscriber later = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, later));
        assertThat(later.statuses()).containsExactly(SubscriptionStatus.DISCONNECTED);
    }

    @Test
    void recoveryReceivesFailureAndRecovery() {
        transport.autoConfirm(false);
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.setRecovery(new ChannelRecovery() {
            @Override
            public void channelFailed(String topic, TransportException error) {
                calls.add("failed:" + topic);
            }

            @Override
            public void channelRecovered(String topic) {
                calls.add("recovered:" + topic);
            }

            @Override
            public void channelClosed(String topic) {
                calls.add("closed:" + topic);
            }
        });
        SubscriberHandle handle = registry.subscribe(TOPIC);
        transport.last(TOPIC).fail(SubscribeStatus.TIMED_OUT);
        assertThat(registry.reopen(TOPIC)).isTrue();
        transport.last(TOPIC).confirm();
        handle.close();

        assertThat(calls).containsExactly("failed:" + TOPIC, "recovered:" + TOPIC, "closed:" + TOPIC);
        assertThat(transport.openedCount(TOPIC)).isEqualTo(2);
    }

    @Test
    void recreatedChannelIgnoresStatusOfPreviousChannel() {
        transport.autoConfirm(false);
        SubscriberHandle first = registry.subscribe(TOPIC);
        long firstGeneration = registry.snapshot(TOPIC).orElseThrow().generation();
        FakeTransportChannel stale = transport.last(TOPIC);
        first.close();

        held.add(registry.subscribe(TOPIC));
        FakeTransportChannel fresh = transport.last(TOPIC);
        stale.confirm();

        ChannelSnapshot snapshot = registry.snapshot(TOPIC).orElseThrow();
        assertThat(snapshot.generation()).isNotEqualTo(firstGeneration);
        assertThat(snapshot.state()).isEqualTo(ChannelState.SUBSCRIBING);

        fresh.confirm();
        assertThat(registry.snapshot(TOPIC).orElseThrow().state()).isEqualTo(ChannelState.SUBSCRIBED);
    }

    @Test
    void reconnectKeepsChannelIdentityAndSubscribers() {
        RecordingSubscriber subscriber = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, subscriber));
        long generation = registry.snapshot(TOPIC).orElseThrow().generation();

        registry.markReconnecting();
        assertThat(registry.snapshot(TOPIC).orElseThrow().state()).isEqualTo(ChannelState.RECONNECTING);

        assertThat(registry.resubscribeAll()).isEqualTo(1);

        ChannelSnapshot snapshot = registry.snapshot(TOPIC).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(ChannelState.SUBSCRIBED);
        assertThat(snapshot.generation()).isEqualTo(generation);
        assertThat(snapshot.refCount()).isEqualTo(1);
        assertThat(transport.openedCount(TOPIC)).isEqualTo(2);
        assertThat(transport.opened().get(0).isRemoved()).isTrue();
        assertThat(subscriber.statuses()).containsExactly(
                SubscriptionStatus.SUBSCRIBED, SubscriptionStatus.RECONNECTING, SubscriptionStatus.SUBSCRIBED);
    }

    @Test
    void resubscribeSkipsConfirmedChannels() {
        held.add(registry.subscribe(TOPIC));

        assertThat(registry.resubscribeAll()).isZero();
        assertThat(transport.openedCount(TOPIC)).isEqualTo(1);
    }

    @Test
    void disconnectedIsReportedOnlyForWaitingChannels() {
        transport.autoConfirm(false);
        RecordingSubscriber waiting = new RecordingSubscriber();
        RecordingSubscriber healthy = new RecordingSubscriber();
        held.add(registry.subscribe(TOPIC, waiting));
        held.add(registry.subscribe("chat-456", healthy));
        transport.last("chat-456").confirm();
        transport.last(TOPIC).fail(SubscribeStatus.CHANNEL_ERROR);

        registry.notifyDisconnected();

        assertThat(waiting.lastStatus()).isEqualTo(SubscriptionStatus.DISCONNECTED);
        assertThat(healthy.statuses()).containsExactly(SubscriptionStatus.SUBSCRIBED);
    }

    @Test
    void closeAllTearsDownEveryChannel() {
        RecordingSubscriber chat = new RecordingSubscriber();
        RecordingSubscriber forum = new RecordingSubscriber();
        SubscriberHandle chatHandle = registry.subscribe(TOPIC, chat);
        SubscriberHandle forumHandle = registry.subscribe("forum-7", forum);
        assertThat(registry.activeTopics()).containsExactly(TOPIC, "forum-7");

        registry.closeAll();

        assertThat(registry.activeTopics()).isEmpty();
        assertThat(chatHandle.isActive()).isFalse();
        assertThat(forumHandle.isActive()).isFalse();
        assertThat(chat.lastStatus()).isEqualTo(SubscriptionStatus.CLOSED);
        assertThat(forum.lastStatus()).isEqualTo(SubscriptionStatus.CLOSED);
        assertThat(transport.removed()).hasSize(2);
        assertThat(registry.unsubscribe(chatHandle)).isFalse();
    }

    @Test
    void teardownDropsListenersAndHistory() {
        List<ChangeEvent> received = new CopyOnWriteArrayList<>();
        SubscriberHandle handle = registry.subscribe(TOPIC);
        events.onChange(TOPIC, ChangeFilter.all(), received::add);
        transport.last(TOPIC).emitChange(ChangeOperation.INSERT, "messages", Map.of("id", 1));
        assertThat(events.recentChanges(TOPIC)).hasSize(1);

        handle.close();
        held.add(registry.subscribe(TOPIC));
        transport.last(TOPIC).emitChange(ChangeOperation.INSERT, "messages", Map.of("id", 2));

        assertThat(received).hasSize(1);
        List<ChangeEvent> history = events.recentChanges(TOPIC);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).after()).containsEntry("id", 2);
    }

    @Test
    void rejectsHandlesOfOtherRegistries() {
        MutableClock clock = new MutableClock(Instant.EPOCH);
        DefaultChannelRegistry other = new DefaultChannelRegistry(transport,
                new DefaultEventStream(Runnable::run, EventStreamSettings.defaults()),
                new DefaultPresenceTracker(new ManualTaskScheduler(clock), clock, PresenceSettings.defaults()));
        SubscriberHandle foreign = other.subscribe(TOPIC);
        held.add(foreign);

        assertThatThrownBy(() -> registry.unsubscribe(foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidTopics() {
        assertThatThrownBy(() -> registry.subscribe("chat 123")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.subscribe(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(transport.opened()).isEmpty();
    }

    @Test
    @Timeout(30)
    void unreachableHandleIsReleasedOnNextMutation() throws InterruptedException {
        subscribeAndForget(TOPIC);
        assertThat(registry.snapshot(TOPIC)).isPresent();

        for (int i = 0; i < 100 && registry.snapshot(TOPIC).isPresent(); i++) {
            System.gc();
            Thread.sleep(20);
            registry.unsubscribe(registry.subscribe("churn-1"));
        }

        assertThat(registry.snapshot(TOPIC)).isEmpty();
        assertThat(transport.last(TOPIC).isRemoved()).isTrue();
    }

    private void subscribeAndForget(String topic) {
        registry.subscribe(topic);
    }
}
