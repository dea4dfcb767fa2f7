package com.qqsuccubus.longpoll.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.EventsTestHarness;
import com.qqsuccubus.longpoll.server.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.longpoll.server.poll.PollOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private EventsTestHarness harness;
    private HttpServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        harness = new EventsTestHarness();
        EventsApiHandler api = new EventsApiHandler(harness.registration, harness.controller, harness.actions);
        server = new HttpServer(harness.config, api, new PrometheusMetricsExporter(harness.config.getNodeId()));
        DisposableServer bound = server.start();
        client = HttpClient.create().baseUrl("http://localhost:" + bound.port());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void testHealthz() {
        String body = client.get().uri("/healthz")
            .responseSingle((res, content) -> content.asString())
            .block(TIMEOUT);

        assertEquals("OK", body);
    }

    @Test
    void testRegisterSendAndPoll() {
        Response registered = post(harness.ids.getHamlet(), "/api/v1/register",
            "{\"event_types\": [\"message\", \"pointer\"], \"apply_markdown\": true}");
        assertEquals(200, registered.status);
        String queueId = registered.json.get("queue_id").asText();
        assertEquals(-1, registered.json.get("last_event_id").asLong());
        assertTrue(registered.json.has("max_message_id"));

        Response sent = post(harness.ids.getHamlet(), "/api/v1/messages",
            "{\"type\": \"stream\", \"to\": \"Verona\", \"subject\": \"http\", \"content\": \"hi **there**\","
                + " \"queue_id\": \"" + queueId + "\", \"local_id\": \"1.01\"}");
        assertEquals(200, sent.status);
        long messageId = sent.json.get("id").asLong();

        Response polled = get(harness.ids.getHamlet(), "/api/v1/events?queue_id=" + queueId + "&last_event_id=-1");
        assertEquals(200, polled.status);
        assertEquals("success", polled.json.get("result").asText());
        JsonNode event = polled.json.get("events").get(0);
        assertEquals("message", event.get("type").asText());
        assertEquals(messageId, event.get("message").get("id").asLong());
        assertEquals("text/html", event.get("message").get("content_type").asText());
        assertEquals("1.01", event.get("local_message_id").asText());

        long lastId = event.get("id").asLong();
        Response empty = get(harness.ids.getHamlet(),
            "/api/v1/events?queue_id=" + queueId + "&last_event_id=" + lastId + "&dont_block=true");
        assertEquals(0, empty.json.get("events").size());
    }

    @Test
    void testLongPollReturnsWhenEventArrives() throws Exception {
        String queueId = post(harness.ids.getOthello(), "/api/v1/register", "{\"event_types\": [\"pointer\"]}")
            .json.get("queue_id").asText();

        CompletableFuture<Response> pending = CompletableFuture.supplyAsync(() ->
            get(harness.ids.getOthello(), "/api/v1/events?queue_id=" + queueId));

        awaitPendingPoll(queueId, harness.ids.getOthello());
        Response pointer = post(harness.ids.getOthello(), "/api/v1/pointer", "{\"pointer\": 42}");
        assertEquals(200, pointer.status);

        Response polled = pending.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        assertEquals(42, polled.json.get("events").get(0).get("pointer").asLong());
        assertEquals(1.0, harness.metrics.getPollCount(PollOutcome.WOKEN));
    }

    @Test
    void testBadQueueId() {
        Response response = get(harness.ids.getHamlet(), "/api/v1/events?queue_id=gen1:12345&dont_block=true");

        assertEquals(400, response.status);
        assertEquals("error", response.json.get("result").asText());
        assertEquals("BAD_EVENT_QUEUE_ID", response.json.get("code").asText());
    }

    @Test
    void testDeleteQueue() {
        String queueId = post(harness.ids.getHamlet(), "/api/v1/register", "{}").json.get("queue_id").asText();

        Response deleted = receive(as(harness.ids.getHamlet()).delete().uri("/api/v1/events?queue_id=" + queueId));
        assertEquals(200, deleted.status);

        Response polled = get(harness.ids.getHamlet(), "/api/v1/events?queue_id=" + queueId + "&dont_block=true");
        assertEquals(400, polled.status);
    }

    @Test
    void testMissingPrincipal() {
        Response response = receive(client.post().uri("/api/v1/register")
            .send(ByteBufFlux.fromString(Mono.just("{}"))));

        assertEquals(401, response.status);
        assertEquals("UNAUTHORIZED", response.json.get("code").asText());
    }

    @Test
    void testInvalidNarrow() {
        Response response = post(harness.ids.getHamlet(), "/api/v1/register",
            "{\"narrow\": [[\"stream\", \"Atlantis\"]]}");

        assertEquals(400, response.status);
        assertEquals("BAD_REQUEST", response.json.get("code").asText());
    }

    private void awaitPendingPoll(String queueId, long principalId) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (harness.registry.lookup(queueId, principalId).getPendingPolls() == 0) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("poll never reached the server");
            }
            Thread.onSpinWait();
        }
    }

    private HttpClient as(long principalId) {
        return client.headers(h -> h.set(EventsApiHandler.PRINCIPAL_HEADER, principalId));
    }

    private Response post(long principalId, String uri, String body) {
        return receive(as(principalId).post().uri(uri).send(ByteBufFlux.fromString(Mono.just(body))));
    }

    private Response get(long principalId, String uri) {
        return receive(as(principalId).get().uri(uri));
    }

    private static Response receive(HttpClient.ResponseReceiver<?> receiver) {
        return receiver
            .responseSingle((res, content) -> content.asString()
                .map(text -> new Response(res.status().code(), JsonUtils.readTree(text))))
            .block(TIMEOUT);
    }

    private static class Response {
        final int status;
        final JsonNode json;

        Response(int status, JsonNode json) {
            this.status = status;
            this.json = json;
        }
    }
}
