package com.qqsuccubus.longpoll.server;

import com.qqsuccubus.longpoll.core.queue.MarkerResetScope;
import com.qqsuccubus.longpoll.core.state.StateReconciler;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.dispatch.Dispatcher;
import com.qqsuccubus.longpoll.server.metrics.MetricsService;
import com.qqsuccubus.longpoll.server.poll.LongPollController;
import com.qqsuccubus.longpoll.server.realm.DemoRealm;
import com.qqsuccubus.longpoll.server.realm.RealmActions;
import com.qqsuccubus.longpoll.server.realm.RealmStore;
import com.qqsuccubus.longpoll.server.register.RegisterRequest;
import com.qqsuccubus.longpoll.server.register.RegistrationService;
import com.qqsuccubus.longpoll.server.registry.QueueRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Wires the whole event pipeline in memory around a seeded demo realm, with a clock tests can move.
 */
public class EventsTestHarness {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    public final ServerConfig config;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MetricsService metrics;
    public final RealmStore store = new RealmStore();
    public final QueueRegistry registry;
    public final Dispatcher dispatcher;
    public final RealmActions actions;
    public final StateReconciler reconciler = new StateReconciler(store);
    public final RegistrationService registration;
    public final LongPollController controller;
    public final DemoRealm.Ids ids;

    public EventsTestHarness() {
        this(testConfig().build());
    }

    public EventsTestHarness(ServerConfig config) {
        this.config = config;
        this.metrics = new MetricsService(meterRegistry, config);
        this.registry = new QueueRegistry(config, store, metrics, clock, "gen1");
        this.dispatcher = new Dispatcher(registry, metrics);
        this.actions = new RealmActions(store, dispatcher, clock);
        this.registration = new RegistrationService(registry, reconciler, store);
        this.controller = new LongPollController(registry, config, metrics, clock);
        this.ids = DemoRealm.seed(actions);
    }

    public static ServerConfig.ServerConfigBuilder testConfig() {
        return ServerConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .queueIdleTimeout(Duration.ofMinutes(10))
            .queueGcInterval(Duration.ofMinutes(1))
            .pollTimeout(Duration.ofSeconds(50))
            .markerResetScope(MarkerResetScope.ALL_KEYS)
            .seedDemoRealm(false);
    }

    public ClientDescriptor register(long principalId, RegisterRequest request) {
        String queueId = registration.register(principalId, request).getQueueId();
        return registry.lookup(queueId, principalId);
    }

    public ClientDescriptor register(long principalId) {
        return register(principalId, RegisterRequest.builder().build());
    }

    /**
     * Clock that only moves when told to.
     */
    public static class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
