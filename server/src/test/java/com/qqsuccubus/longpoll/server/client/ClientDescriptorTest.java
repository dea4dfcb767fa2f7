package com.qqsuccubus.longpoll.server.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;
import com.qqsuccubus.longpoll.core.queue.MarkerResetScope;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientDescriptorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testAccepts_EmptyAllowListTakesEverything() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        assertTrue(client.accepts(pointer(1)));
        assertTrue(client.accepts(Event.of("custom_thing", JsonUtils.object())));
        assertTrue(client.wantsMessages());
    }

    @Test
    void testAccepts_AllowListFiltersByType() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().eventTypes(Set.of("pointer")).build());

        assertTrue(client.accepts(pointer(1)));
        assertFalse(client.accepts(streamMessage("Verona")));
        assertFalse(client.wantsMessages());
        assertEquals(Delivery.FILTERED, client.registerEvent(streamMessage("Verona")));
        assertTrue(client.contents().isEmpty());
    }

    @Test
    void testAccepts_NarrowAppliesToMessagesOnly() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().narrow(Narrow.stream("denmark")).build());

        assertTrue(client.accepts(streamMessage("Denmark")));
        assertFalse(client.accepts(streamMessage("Verona")));
        assertTrue(client.accepts(pointer(3)));
    }

    @Test
    void testRegisterEvent_ReportsCollapsing() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        assertEquals(Delivery.ENQUEUED, client.registerEvent(pointer(1)));
        assertEquals(Delivery.COLLAPSED, client.registerEvent(pointer(2)));
        assertEquals(1, client.contents().size());
    }

    @Test
    void testRegisterEvents_KeepsBatchOrder() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        List<Delivery> outcomes = client.registerEvents(List.of(streamMessage("A"), pointer(1), streamMessage("B")));

        assertEquals(List.of(Delivery.ENQUEUED, Delivery.ENQUEUED, Delivery.ENQUEUED), outcomes);
        assertEquals(List.of("message", "pointer", "message"),
            client.contents().stream().map(Event::getType).toList());
    }

    @Test
    void testIsExpired_AfterLifespanOfIdleness() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        assertFalse(client.isExpired(T0.plus(Duration.ofMinutes(10))));
        assertTrue(client.isExpired(T0.plus(Duration.ofMinutes(10)).plusSeconds(1)));

        client.touch(T0.plus(Duration.ofMinutes(9)));
        assertFalse(client.isExpired(T0.plus(Duration.ofMinutes(15))));
    }

    @Test
    void testIsExpired_NeverWhileAPollIsPending() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        Disposable poll = client.awaitEvents(-1).subscribe();
        assertEquals(1, client.getPendingPolls());
        assertFalse(client.isExpired(T0.plus(Duration.ofHours(1))));

        poll.dispose();
        assertEquals(0, client.getPendingPolls());
        assertTrue(client.isExpired(T0.plus(Duration.ofHours(1))));
    }

    @Test
    void testAwaitEvents_ReturnsQueuedEventsAtOnce() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());
        client.registerEvent(pointer(5));

        StepVerifier.create(client.awaitEvents(-1))
            .assertNext(events -> assertEquals(1, events.size()))
            .verifyComplete();
    }

    @Test
    void testAwaitEvents_WokenByPush() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        StepVerifier.create(client.awaitEvents(-1))
            .expectSubscription()
            .then(() -> client.registerEvent(pointer(7)))
            .assertNext(events -> {
                assertEquals(1, events.size());
                assertEquals(7, events.get(0).get("pointer").asLong());
            })
            .verifyComplete();
    }

    @Test
    void testAwaitEvents_IgnoresFilteredPushes() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().eventTypes(Set.of("message")).build());

        StepVerifier.create(client.awaitEvents(-1))
            .expectSubscription()
            .then(() -> client.registerEvent(pointer(7)))
            .expectNoEvent(Duration.ofMillis(50))
            .then(() -> client.registerEvent(streamMessage("Verona")))
            .assertNext(events -> assertEquals("message", events.get(0).getType()))
            .verifyComplete();
    }

    @Test
    void testDisconnect_CompletesPendingWaitEmpty() {
        ClientDescriptor client = descriptor(ClientRegistration.builder().build());

        StepVerifier.create(client.awaitEvents(-1))
            .expectSubscription()
            .then(client::disconnect)
            .verifyComplete();
        assertTrue(client.isClosed());
    }

    @Test
    void testMarkerResetScope_ReachesTheQueue() {
        ClientDescriptor client = new ClientDescriptor("g:1", ClientRegistration.builder().build(),
            Duration.ofMinutes(10), MarkerResetScope.NON_FLAG_KEYS, T0);

        client.registerEvent(flags(1));
        client.registerEvent(Event.of(EventType.RESTART, JsonUtils.object().put("server_generation", "g")));
        client.registerEvent(flags(2));

        assertEquals(2, client.contents().size());
    }

    private static ClientDescriptor descriptor(ClientRegistration registration) {
        return new ClientDescriptor("g:0", registration, Duration.ofMinutes(10), MarkerResetScope.ALL_KEYS, T0);
    }

    private static Event pointer(long pointer) {
        return Event.of(EventType.POINTER, JsonUtils.object().put("pointer", pointer));
    }

    private static Event flags(long messageId) {
        ObjectNode fields = JsonUtils.object().put("operation", "add").put("flag", "read").put("all", false);
        fields.putArray("messages").add(messageId);
        return Event.of(EventType.UPDATE_MESSAGE_FLAGS, fields);
    }

    private static Event streamMessage(String stream) {
        ObjectNode fields = JsonUtils.object();
        fields.putObject("message")
            .put("id", 1)
            .put("type", "stream")
            .put("display_recipient", stream)
            .put("subject", "test");
        return Event.of(EventType.MESSAGE, fields);
    }
}
