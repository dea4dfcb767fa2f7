package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotTest {

    @Test
    void testKeyedSections_IgnoreEntryOrder() {
        Snapshot a = snapshot("{\"realm_users\":[{\"email\":\"a@x\",\"full_name\":\"A\"},{\"email\":\"b@x\",\"full_name\":\"B\"}]}");
        Snapshot b = snapshot("{\"realm_users\":[{\"email\":\"b@x\",\"full_name\":\"B\"},{\"email\":\"a@x\",\"full_name\":\"A\"}]}");

        assertTrue(a.matches(b));
        assertTrue(a.normalized().get("realm_users").has("a@x"));
    }

    @Test
    void testUnkeyedSections_KeepEntryOrder() {
        Snapshot a = snapshot("{\"alert_words\":[\"one\",\"two\"]}");
        Snapshot b = snapshot("{\"alert_words\":[\"two\",\"one\"]}");

        assertFalse(a.matches(b));
    }

    @Test
    void testNumbers_CompareByValue() {
        ObjectNode intState = JsonUtils.object().put("pointer", 5);
        ObjectNode longState = JsonUtils.object().put("pointer", 5L);

        assertTrue(new Snapshot(intState).matches(new Snapshot(longState)));
    }

    @Test
    void testFieldDifferences_AreDetected() {
        Snapshot a = snapshot("{\"subscriptions\":[{\"name\":\"Verona\",\"description\":\"old\"}]}");
        Snapshot b = snapshot("{\"subscriptions\":[{\"name\":\"Verona\",\"description\":\"new\"}]}");

        assertFalse(a.matches(b));
    }

    @Test
    void testSnapshot_IsDetachedFromItsInput() {
        ObjectNode state = JsonUtils.object().put("pointer", 1);
        Snapshot snapshot = new Snapshot(state);
        state.put("pointer", 2);

        assertEquals(1, snapshot.get(SnapshotSection.POINTER).asLong());
        assertTrue(snapshot.has("pointer"));
        assertFalse(snapshot.has(SnapshotSection.REALM_NAME));
        assertTrue(snapshot.copy().matches(snapshot));
    }

    private static Snapshot snapshot(String json) {
        return new Snapshot((ObjectNode) JsonUtils.readTree(json));
    }
}
