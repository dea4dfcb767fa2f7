package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.error.UnhandledEventTypeException;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateReconcilerTest {

    private FixedSnapshotSource source;
    private StateReconciler reconciler;

    @BeforeEach
    void setUp() {
        source = new FixedSnapshotSource(json("{"
            + "\"pointer\": 10,"
            + "\"max_message_id\": 4,"
            + "\"email\": \"hamlet@zulip.com\","
            + "\"full_name\": \"King Hamlet\","
            + "\"is_admin\": false,"
            + "\"realm_users\": [{\"email\": \"hamlet@zulip.com\", \"full_name\": \"King Hamlet\", \"is_admin\": false}],"
            + "\"realm_bots\": [],"
            + "\"subscriptions\": [{\"name\": \"Verona\", \"description\": \"\", \"subscribers\": [\"hamlet@zulip.com\"]}],"
            + "\"unsubscribed\": [],"
            + "\"never_subscribed\": [{\"name\": \"Rome\", \"description\": \"\"}],"
            + "\"realm_name\": \"Zulip\""
            + "}"));
        reconciler = new StateReconciler(source);
    }

    @Test
    void testSnapshot_PassesWantedTypesToSource() {
        reconciler.snapshot(7, List.of("pointer", "no_such_type"), Narrow.NONE);

        assertEquals(7, source.lastPrincipal);
        assertEquals(EnumSet.of(EventType.POINTER), source.lastWanted);
    }

    @Test
    void testSnapshot_EmptyTypesMeansAll() {
        reconciler.snapshot(7, List.of(), Narrow.NONE);

        assertEquals(EnumSet.allOf(EventType.class), source.lastWanted);
    }

    @Test
    void testPointer_OnlyMovesForward() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(event("pointer", "{\"pointer\": 15}"), event("pointer", "{\"pointer\": 12}")));

        assertEquals(15, state.get("pointer").asLong());
    }

    @Test
    void testMessage_RaisesMaxMessageId() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(event("message", "{\"message\": {\"id\": 9}, \"flags\": []}")));

        assertEquals(9, state.get("max_message_id").asLong());
    }

    @Test
    void testRealmUser_AddUpdateRemove() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(
            event("realm_user", "{\"op\": \"add\", \"person\": {\"email\": \"test1@zulip.com\", \"full_name\": \"Test\", \"is_admin\": false}}"),
            event("realm_user", "{\"op\": \"update\", \"person\": {\"email\": \"hamlet@zulip.com\", \"full_name\": \"Sir Hamlet\"}}"),
            event("realm_user", "{\"op\": \"update\", \"person\": {\"email\": \"hamlet@zulip.com\", \"is_admin\": true}}"),
            event("realm_user", "{\"op\": \"remove\", \"person\": {\"email\": \"test1@zulip.com\", \"full_name\": \"Test\"}}")));

        assertEquals(1, state.get("realm_users").size());
        assertEquals("Sir Hamlet", state.get("realm_users").get(0).get("full_name").asText());
        assertEquals("Sir Hamlet", state.get("full_name").asText());
        assertTrue(state.get("is_admin").asBoolean());
    }

    @Test
    void testRealmBot_AddAndUpdate() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(
            event("realm_bot", "{\"op\": \"add\", \"bot\": {\"email\": \"bot@zulip.com\", \"api_key\": \"k1\"}}"),
            event("realm_bot", "{\"op\": \"update\", \"bot\": {\"email\": \"bot@zulip.com\", \"api_key\": \"k2\"}}")));

        assertEquals("k2", state.get("realm_bots").get(0).get("api_key").asText());
    }

    @Test
    void testSubscription_AddMovesOutOfNeverSubscribed() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(event("subscription",
            "{\"op\": \"add\", \"subscriptions\": [{\"name\": \"Rome\", \"description\": \"\", \"subscribers\": [\"hamlet@zulip.com\"]}]}")));

        assertEquals(2, state.get("subscriptions").size());
        assertEquals(0, state.get("never_subscribed").size());
    }

    @Test
    void testSubscription_RemoveMovesToUnsubscribedWithoutSubscribers() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(event("subscription",
            "{\"op\": \"remove\", \"subscriptions\": [{\"name\": \"verona\", \"stream_id\": 1}]}")));

        assertEquals(0, state.get("subscriptions").size());
        JsonNode former = state.get("unsubscribed").get(0);
        assertEquals("Verona", former.get("name").asText());
        assertFalse(former.has("subscribers"));
    }

    @Test
    void testSubscription_PeerEventsKeepSubscribersSorted() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(
            event("subscription", "{\"op\": \"peer_add\", \"user_email\": \"aaron@zulip.com\", \"subscriptions\": [\"Verona\"]}"),
            event("subscription", "{\"op\": \"peer_add\", \"user_email\": \"zoe@zulip.com\", \"subscriptions\": [\"Verona\"]}"),
            event("subscription", "{\"op\": \"peer_remove\", \"user_email\": \"hamlet@zulip.com\", \"subscriptions\": [\"Verona\"]}")));

        assertEquals(json("[\"aaron@zulip.com\", \"zoe@zulip.com\"]"),
            state.get("subscriptions").get(0).get("subscribers"));
    }

    @Test
    void testStream_RenameIsKeyedByOldName() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(
            event("stream", "{\"op\": \"update\", \"name\": \"Verona\", \"property\": \"email_address\", \"value\": \"new@x\"}"),
            event("stream", "{\"op\": \"update\", \"name\": \"Verona\", \"property\": \"name\", \"value\": \"Padua\"}"),
            event("stream", "{\"op\": \"update\", \"name\": \"Padua\", \"property\": \"description\", \"value\": \"renamed\"}")));

        JsonNode subscription = state.get("subscriptions").get(0);
        assertEquals("Padua", subscription.get("name").asText());
        assertEquals("new@x", subscription.get("email_address").asText());
        assertEquals("renamed", subscription.get("description").asText());
    }

    @Test
    void testRealm_UpdateName() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(event("realm", "{\"op\": \"update\", \"property\": \"name\", \"value\": \"New\"}")));

        assertEquals("New", state.get("realm_name").asText());
    }

    @Test
    void testMissingSections_AreNotCreated() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        reconciler.apply(state, List.of(
            event("realm_emoji", "{\"op\": \"update\", \"realm_emoji\": {}}"),
            event("alert_words", "{\"alert_words\": [\"x\"]}"),
            event("update_message_flags", "{\"operation\": \"add\", \"flag\": \"read\", \"messages\": [1], \"all\": false}"),
            event("restart", "{\"server_generation\": \"g\"}")));

        assertFalse(state.has(SnapshotSection.REALM_EMOJI));
        assertFalse(state.has(SnapshotSection.ALERT_WORDS));
    }

    @Test
    void testUnknownEventType_Throws() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        assertThrows(UnhandledEventTypeException.class,
            () -> reconciler.apply(state, List.of(event("custom_thing", "{}"))));
    }

    @Test
    void testUnknownOp_Throws() {
        Snapshot state = reconciler.snapshot(1, List.of(), Narrow.NONE);

        assertThrows(UnhandledEventTypeException.class,
            () -> reconciler.apply(state, List.of(event("subscription", "{\"op\": \"explode\"}"))));
    }

    private static Event event(String type, String fields) {
        return Event.of(type, (ObjectNode) json(fields));
    }

    private static JsonNode json(String text) {
        return JsonUtils.readTree(text);
    }

    /**
     * Test stub returning the same state for every principal.
     */
    private static class FixedSnapshotSource implements SnapshotSource {
        private final JsonNode state;
        private long lastPrincipal;
        private Set<EventType> lastWanted;

        FixedSnapshotSource(JsonNode state) {
            this.state = state;
        }

        @Override
        public ObjectNode fetchSections(long principalId, Set<EventType> wanted, Narrow narrow) {
            lastPrincipal = principalId;
            lastWanted = wanted;
            return (ObjectNode) state.deepCopy();
        }
    }
}
