package com.qqsuccubus.longpoll.server;

import com.qqsuccubus.longpoll.core.state.StateReconciler;
import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.dispatch.Dispatcher;
import com.qqsuccubus.longpoll.server.http.EventsApiHandler;
import com.qqsuccubus.longpoll.server.http.HttpServer;
import com.qqsuccubus.longpoll.server.metrics.MetricsService;
import com.qqsuccubus.longpoll.server.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.longpoll.server.poll.LongPollController;
import com.qqsuccubus.longpoll.server.realm.DemoRealm;
import com.qqsuccubus.longpoll.server.realm.RealmActions;
import com.qqsuccubus.longpoll.server.realm.RealmStore;
import com.qqsuccubus.longpoll.server.register.RegistrationService;
import com.qqsuccubus.longpoll.server.registry.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Clock;

/**
 * Main entry point for the events server.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Register clients at /api/v1/register and hand out queue ids plus initial state</li>
 *   <li>Serve long polls at /api/v1/events</li>
 *   <li>Garbage collect idle queues</li>
 *   <li>Tell polling clients to re-register when the node shuts down</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class EventsApp {
    private static final Logger log = LoggerFactory.getLogger(EventsApp.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting events node: {}", config.getNodeId());
        log.info("  Queue idle timeout: {}, sweep interval: {}", config.getQueueIdleTimeout(), config.getQueueGcInterval());
        log.info("  Poll timeout: {}, marker reset scope: {}", config.getPollTimeout(), config.getMarkerResetScope());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RealmStore realmStore = new RealmStore();
        QueueRegistry registry = new QueueRegistry(config, realmStore, metricsService, clock);
        Dispatcher dispatcher = new Dispatcher(registry, metricsService);
        RealmActions realmActions = new RealmActions(realmStore, dispatcher, clock);
        if (config.isSeedDemoRealm()) {
            DemoRealm.seed(realmActions);
        }

        LongPollController pollController = new LongPollController(registry, config, metricsService, clock);
        RegistrationService registrationService =
            new RegistrationService(registry, new StateReconciler(realmStore), realmStore);

        HttpServer httpServer = new HttpServer(
            config,
            new EventsApiHandler(registrationService, pollController, realmActions),
            metricsExporter
        );
        httpServer.start();

        Disposable sweeper = registry.start();

        log.info("Events node {} is ready, generation {}", config.getNodeId(), registry.getServerGeneration());

        handleShutdown(config, registry, dispatcher, httpServer, sweeper);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(ServerConfig config,
                                       QueueRegistry registry,
                                       Dispatcher dispatcher,
                                       HttpServer httpServer,
                                       Disposable sweeper) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            sweeper.dispose();

            // Queue ids die with this process; pending polls return the marker so clients re-register
            dispatcher.broadcastRestart(registry.getServerGeneration());
            httpServer.stop();
            registry.teardown();

            log.info("Shutdown complete");
        }));
    }
}
