package com.qqsuccubus.longpoll.server.http;

import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.metrics.PrometheusMetricsExporter;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;

/**
 * HTTP server for the events API, health checks and metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ServerConfig config;
    private final EventsApiHandler api;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Binds the server; port 0 picks a free port (see {@link DisposableServer#port()}).
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, uri -> uri.startsWith("/api/v1/events") ? "/api/v1/events" : uri)
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .post("/api/v1/register", api::register)
                .get("/api/v1/events", api::getEvents)
                .delete("/api/v1/events", api::deleteQueue)
                .post("/api/v1/messages", api::sendMessage)
                .post("/api/v1/pointer", api::updatePointer)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
