package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.error.UnhandledEventTypeException;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.util.JsonUtils;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Per-type snapshot transforms. Each one only touches sections the snapshot carries.
 */
final class StateTransforms {
    private StateTransforms() {
    }

    static void message(ObjectNode state, Event event) {
        if (state.has(SnapshotSection.MAX_MESSAGE_ID.getKey())) {
            long messageId = event.get("message").path("id").asLong();
            long current = state.path(SnapshotSection.MAX_MESSAGE_ID.getKey()).asLong(-1);
            state.put(SnapshotSection.MAX_MESSAGE_ID.getKey(), Math.max(current, messageId));
        }
    }

    static void pointer(ObjectNode state, Event event) {
        if (state.has(SnapshotSection.POINTER.getKey())) {
            long current = state.path(SnapshotSection.POINTER.getKey()).asLong(-1);
            state.put(SnapshotSection.POINTER.getKey(), Math.max(current, event.get("pointer").asLong()));
        }
    }

    /**
     * For events that change nothing a snapshot holds: edits and flag changes reach the client
     * with the messages themselves, and a restart makes the client reload.
     */
    static void noStateChange(ObjectNode state, Event event) {
        // nothing to fold
    }

    static void realmUser(ObjectNode state, Event event) {
        ObjectNode person = (ObjectNode) event.get("person");
        String email = person.path("email").asText();
        ArrayNode users = list(state, SnapshotSection.REALM_USERS);
        switch (op(event)) {
            case "add" -> {
                if (users != null) {
                    removeWhere(users, byField("email", email));
                    users.add(person);
                }
            }
            case "remove" -> {
                if (users != null) {
                    removeWhere(users, byField("email", email));
                }
            }
            case "update" -> {
                if (users != null) {
                    users.forEach(user -> {
                        if (email.equals(user.path("email").asText())) {
                            ((ObjectNode) user).setAll(person.deepCopy());
                        }
                    });
                }
                if (email.equals(state.path(SnapshotSection.EMAIL.getKey()).asText(null))) {
                    patchProfile(state, person, SnapshotSection.FULL_NAME);
                    patchProfile(state, person, SnapshotSection.IS_ADMIN);
                }
            }
            default -> throw unhandled(event);
        }
    }

    static void realmBot(ObjectNode state, Event event) {
        ObjectNode bot = (ObjectNode) event.get("bot");
        String email = bot.path("email").asText();
        ArrayNode bots = list(state, SnapshotSection.REALM_BOTS);
        switch (op(event)) {
            case "add" -> {
                if (bots != null) {
                    removeWhere(bots, byField("email", email));
                    bots.add(bot);
                }
            }
            case "remove" -> {
                if (bots != null) {
                    removeWhere(bots, byField("email", email));
                }
            }
            case "update" -> {
                if (bots != null) {
                    bots.forEach(existing -> {
                        if (email.equals(existing.path("email").asText())) {
                            ((ObjectNode) existing).setAll(bot.deepCopy());
                        }
                    });
                }
            }
            default -> throw unhandled(event);
        }
    }

    static void subscription(ObjectNode state, Event event) {
        ArrayNode subscriptions = list(state, SnapshotSection.SUBSCRIPTIONS);
        ArrayNode unsubscribed = list(state, SnapshotSection.UNSUBSCRIBED);
        ArrayNode neverSubscribed = list(state, SnapshotSection.NEVER_SUBSCRIBED);
        switch (op(event)) {
            case "add" -> {
                Set<String> added = streamNames(event.get("subscriptions"));
                Predicate<JsonNode> wasAdded = entry -> added.contains(nameOf(entry));
                if (subscriptions != null) {
                    removeWhere(subscriptions, wasAdded);
                    event.get("subscriptions").forEach(subscriptions::add);
                }
                removeWhere(unsubscribed, wasAdded);
                removeWhere(neverSubscribed, wasAdded);
            }
            case "remove" -> {
                Set<String> removed = streamNames(event.get("subscriptions"));
                if (subscriptions == null) {
                    return;
                }
                for (int i = subscriptions.size() - 1; i >= 0; i--) {
                    JsonNode entry = subscriptions.get(i);
                    if (removed.contains(nameOf(entry))) {
                        ObjectNode former = ((ObjectNode) entry).deepCopy();
                        former.remove("subscribers");
                        if (unsubscribed != null) {
                            unsubscribed.add(former);
                        }
                        subscriptions.remove(i);
                    }
                }
            }
            case "update" -> {
                String name = event.text("name").toLowerCase();
                forEachNamed(subscriptions, name,
                    entry -> entry.set(event.text("property"), event.get("value")));
            }
            case "peer_add", "peer_remove" -> {
                boolean add = "peer_add".equals(op(event));
                String peer = event.text("user_email");
                Set<String> streams = new HashSet<>();
                event.get("subscriptions").forEach(n -> streams.add(n.asText().toLowerCase()));
                if (subscriptions == null) {
                    return;
                }
                subscriptions.forEach(entry -> {
                    if (streams.contains(nameOf(entry))) {
                        updateSubscribers((ObjectNode) entry, peer, add);
                    }
                });
            }
            default -> throw unhandled(event);
        }
    }

    static void stream(ObjectNode state, Event event) {
        switch (op(event)) {
            case "create" -> {
                ArrayNode neverSubscribed = list(state, SnapshotSection.NEVER_SUBSCRIBED);
                if (neverSubscribed == null) {
                    return;
                }
                for (JsonNode stream : event.get("streams")) {
                    String name = nameOf(stream);
                    if (!containsName(list(state, SnapshotSection.SUBSCRIPTIONS), name)
                        && !containsName(list(state, SnapshotSection.UNSUBSCRIBED), name)
                        && !containsName(neverSubscribed, name)) {
                        neverSubscribed.add(stream);
                    }
                }
            }
            case "update" -> {
                String name = event.text("name").toLowerCase();
                String property = event.text("property");
                JsonNode value = event.get("value");
                for (SnapshotSection section : new SnapshotSection[]{
                    SnapshotSection.SUBSCRIPTIONS, SnapshotSection.UNSUBSCRIBED, SnapshotSection.NEVER_SUBSCRIBED}) {
                    forEachNamed(list(state, section), name, entry -> entry.set(property, value.deepCopy()));
                }
            }
            default -> throw unhandled(event);
        }
    }

    static void realm(ObjectNode state, Event event) {
        if (!"update".equals(op(event))) {
            throw unhandled(event);
        }
        String field = "realm_" + event.text("property");
        if (state.has(field)) {
            state.set(field, event.get("value"));
        }
    }

    static void realmEmoji(ObjectNode state, Event event) {
        replaceSection(state, SnapshotSection.REALM_EMOJI, event, "realm_emoji");
    }

    static void realmFilters(ObjectNode state, Event event) {
        replaceSection(state, SnapshotSection.REALM_FILTERS, event, "realm_filters");
    }

    static void alertWords(ObjectNode state, Event event) {
        replaceSection(state, SnapshotSection.ALERT_WORDS, event, "alert_words");
    }

    static void mutedTopics(ObjectNode state, Event event) {
        replaceSection(state, SnapshotSection.MUTED_TOPICS, event, "muted_topics");
    }

    private static void replaceSection(ObjectNode state, SnapshotSection section, Event event, String field) {
        if (state.has(section.getKey())) {
            state.set(section.getKey(), event.get(field));
        }
    }

    private static void patchProfile(ObjectNode state, ObjectNode person, SnapshotSection section) {
        if (state.has(section.getKey()) && person.has(section.getKey())) {
            state.set(section.getKey(), person.get(section.getKey()).deepCopy());
        }
    }

    // Subscriber lists are kept sorted so replayed and freshly fetched lists compare equal.
    private static void updateSubscribers(ObjectNode subscription, String email, boolean add) {
        Set<String> subscribers = new TreeSet<>();
        subscription.path("subscribers").forEach(n -> subscribers.add(n.asText()));
        if (add) {
            subscribers.add(email);
        } else {
            subscribers.remove(email);
        }
        ArrayNode sorted = JsonUtils.array();
        subscribers.forEach(sorted::add);
        subscription.set("subscribers", sorted);
    }

    private static String op(Event event) {
        String op = event.text("op");
        if (op == null) {
            throw unhandled(event);
        }
        return op;
    }

    private static UnhandledEventTypeException unhandled(Event event) {
        return new UnhandledEventTypeException(
            "No state transform for event " + event.getType() + "/" + event.text("op"));
    }

    private static ArrayNode list(ObjectNode state, SnapshotSection section) {
        JsonNode node = state.get(section.getKey());
        return node != null && node.isArray() ? (ArrayNode) node : null;
    }

    private static String nameOf(JsonNode entry) {
        return entry.path("name").asText().toLowerCase();
    }

    private static Set<String> streamNames(JsonNode entries) {
        Set<String> names = new HashSet<>();
        entries.forEach(entry -> names.add(nameOf(entry)));
        return names;
    }

    private static boolean containsName(ArrayNode entries, String lowerName) {
        if (entries == null) {
            return false;
        }
        for (JsonNode entry : entries) {
            if (lowerName.equals(nameOf(entry))) {
                return true;
            }
        }
        return false;
    }

    private static void forEachNamed(ArrayNode entries, String lowerName, Consumer<ObjectNode> action) {
        if (entries == null) {
            return;
        }
        entries.forEach(entry -> {
            if (lowerName.equals(nameOf(entry))) {
                action.accept((ObjectNode) entry);
            }
        });
    }

    private static Predicate<JsonNode> byField(String field, String value) {
        return entry -> value.equals(entry.path(field).asText());
    }

    private static void removeWhere(ArrayNode entries, Predicate<JsonNode> predicate) {
        if (entries == null) {
            return;
        }
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (predicate.test(entries.get(i))) {
                entries.remove(i);
            }
        }
    }
}
