package com.qqsuccubus.longpoll.server.realm;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;
import com.qqsuccubus.longpoll.core.state.SnapshotSection;
import com.qqsuccubus.longpoll.core.state.SnapshotSource;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.register.PrincipalDirectory;
import com.qqsuccubus.longpoll.server.register.PrincipalNotFoundException;
import com.qqsuccubus.longpoll.server.registry.StreamDirectory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory realm data: users, bots, streams, subscriptions, messages and realm settings.
 * <p>
 * Every method synchronizes on the store. {@link RealmActions} holds the same monitor while it
 * mutates data and emits the resulting events, so a snapshot never observes half an action.
 * </p>
 * <p>
 * Snapshots and event payloads describe entities through the same JSON views.
 * </p>
 */
public class RealmStore implements SnapshotSource, StreamDirectory, PrincipalDirectory {
    static final String DEFAULT_COLOR = "#c2c2c2";

    private final Map<Long, Realm> realms = new LinkedHashMap<>();
    private final Map<Long, UserProfile> users = new LinkedHashMap<>();
    private final Map<Long, Stream> streams = new LinkedHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final Map<Long, StoredMessage> messages = new LinkedHashMap<>();

    private long nextRealmId = 1;
    private long nextUserId = 1;
    private long nextStreamId = 1;
    private long nextMessageId = 1;

    public synchronized Realm createRealm(String domain, String name) {
        Realm realm = new Realm(nextRealmId++, domain);
        realm.setName(name);
        realms.put(realm.getId(), realm);
        return realm;
    }

    public synchronized Realm realm(long realmId) {
        Realm realm = realms.get(realmId);
        if (realm == null) {
            throw new IllegalArgumentException("No such realm: " + realmId);
        }
        return realm;
    }

    public synchronized Optional<Realm> realmByDomain(String domain) {
        return realms.values().stream().filter(r -> r.getDomain().equalsIgnoreCase(domain)).findFirst();
    }

    synchronized UserProfile addUser(long realmId, String email, String fullName, boolean bot, Long botOwnerId) {
        realm(realmId);
        if (userByEmail(email).isPresent()) {
            throw new IllegalArgumentException("Email already in use: " + email);
        }
        UserProfile user = new UserProfile(nextUserId++, realmId, email, bot, botOwnerId);
        user.setFullName(fullName);
        user.setApiKey(newApiKey());
        users.put(user.getId(), user);
        return user;
    }

    public synchronized UserProfile user(long userId) {
        UserProfile user = users.get(userId);
        if (user == null) {
            throw new IllegalArgumentException("No such user: " + userId);
        }
        return user;
    }

    public synchronized Optional<UserProfile> userByEmail(String email) {
        return users.values().stream().filter(u -> u.getEmail().equalsIgnoreCase(email)).findFirst();
    }

    synchronized List<UserProfile> activeUsers(long realmId) {
        return users.values().stream().filter(u -> u.getRealmId() == realmId && u.isActive()).toList();
    }

    synchronized Set<Long> activeUserIds(long realmId) {
        Set<Long> ids = new LinkedHashSet<>();
        activeUsers(realmId).forEach(u -> ids.add(u.getId()));
        return ids;
    }

    static String newApiKey() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    synchronized Stream addStream(long realmId, String name, String description, boolean inviteOnly) {
        realm(realmId);
        Stream stream = new Stream(nextStreamId++, realmId, newApiKey().substring(0, 12));
        stream.setName(name);
        stream.setDescription(description);
        stream.setInviteOnly(inviteOnly);
        streams.put(stream.getId(), stream);
        return stream;
    }

    public synchronized Optional<Stream> streamByName(long realmId, String name) {
        return streams.values().stream()
            .filter(s -> s.getRealmId() == realmId && s.getName().equalsIgnoreCase(name))
            .findFirst();
    }

    synchronized Stream stream(long streamId) {
        return streams.get(streamId);
    }

    synchronized Optional<Subscription> subscription(long userId, long streamId) {
        return subscriptions.stream()
            .filter(s -> s.getUserId() == userId && s.getStreamId() == streamId)
            .findFirst();
    }

    synchronized Subscription addSubscription(long userId, long streamId) {
        Subscription subscription = new Subscription(userId, streamId);
        subscription.setColor(DEFAULT_COLOR);
        subscriptions.add(subscription);
        return subscription;
    }

    synchronized List<Subscription> activeSubscriptionsOf(long userId) {
        return subscriptions.stream().filter(s -> s.getUserId() == userId && s.isActive()).toList();
    }

    /**
     * Active users with any subscription row for the stream, active or not.
     */
    synchronized Set<Long> memberIds(long streamId) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Subscription subscription : subscriptions) {
            if (subscription.getStreamId() == streamId && users.get(subscription.getUserId()).isActive()) {
                ids.add(subscription.getUserId());
            }
        }
        return ids;
    }

    /**
     * Active users with an active subscription to the stream.
     */
    synchronized Set<Long> subscriberIds(long streamId) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Subscription subscription : subscriptions) {
            if (subscription.getStreamId() == streamId && subscription.isActive()
                && users.get(subscription.getUserId()).isActive()) {
                ids.add(subscription.getUserId());
            }
        }
        return ids;
    }

    synchronized StoredMessage addMessage(long senderId, String type, Long streamId, String subject,
                                          Set<Long> recipients, long timestamp) {
        StoredMessage message = new StoredMessage(
            nextMessageId++, senderId, type, streamId, subject, Set.copyOf(recipients), timestamp);
        messages.put(message.getId(), message);
        return message;
    }

    synchronized StoredMessage message(long messageId) {
        StoredMessage message = messages.get(messageId);
        if (message == null) {
            throw new IllegalArgumentException("No such message: " + messageId);
        }
        return message;
    }

    @Override
    public synchronized long realmOf(long principalId) {
        return activeUser(principalId).getRealmId();
    }

    @Override
    public synchronized boolean defaultAllPublicStreams(long principalId) {
        return activeUser(principalId).isDefaultAllPublicStreams();
    }

    @Override
    public synchronized Optional<String> defaultEventsRegisterStream(long principalId) {
        return Optional.ofNullable(activeUser(principalId).getDefaultEventsRegisterStream());
    }

    @Override
    public synchronized boolean streamExists(long realmId, String streamName) {
        return streamByName(realmId, streamName).isPresent();
    }

    private UserProfile activeUser(long principalId) {
        UserProfile user = users.get(principalId);
        if (user == null || !user.isActive()) {
            throw new PrincipalNotFoundException(principalId);
        }
        return user;
    }

    /**
     * The narrow does not restrict any section: {@code max_message_id} counts every message the
     * principal received.
     */
    @Override
    public synchronized ObjectNode fetchSections(long principalId, Set<EventType> wanted, Narrow narrow) {
        UserProfile user = activeUser(principalId);
        Realm realm = realm(user.getRealmId());
        ObjectNode state = JsonUtils.object();

        for (SnapshotSection section : SnapshotSection.wantedBy(wanted)) {
            String key = section.getKey();
            switch (section) {
                case ALERT_WORDS -> state.set(key, stringArray(user.getAlertWords()));
                case MAX_MESSAGE_ID -> state.put(key, maxMessageId(user.getId()));
                case MUTED_TOPICS -> state.set(key, mutedTopicsJson(user));
                case POINTER -> state.put(key, user.getPointer());
                case REALM_USERS -> {
                    ArrayNode people = state.putArray(key);
                    activeUsers(realm.getId()).forEach(u -> people.add(personJson(u)));
                }
                case EMAIL -> state.put(key, user.getEmail());
                case FULL_NAME -> state.put(key, user.getFullName());
                case IS_ADMIN -> state.put(key, user.isAdmin());
                case REALM_BOTS -> {
                    ArrayNode bots = state.putArray(key);
                    users.values().stream()
                        .filter(u -> u.isBot() && u.isActive() && Long.valueOf(user.getId()).equals(u.getBotOwnerId()))
                        .forEach(bot -> bots.add(botJson(bot)));
                }
                case SUBSCRIPTIONS -> {
                    ArrayNode subscribed = state.putArray(key);
                    subscriptionsOf(user.getId(), true)
                        .forEach(s -> subscribed.add(subscriptionJson(s, true)));
                }
                case UNSUBSCRIBED -> {
                    ArrayNode unsubscribed = state.putArray(key);
                    subscriptionsOf(user.getId(), false)
                        .forEach(s -> unsubscribed.add(subscriptionJson(s, false)));
                }
                case NEVER_SUBSCRIBED -> {
                    ArrayNode never = state.putArray(key);
                    streams.values().stream()
                        .filter(s -> s.getRealmId() == realm.getId() && !s.isInviteOnly())
                        .filter(s -> subscription(user.getId(), s.getId()).isEmpty())
                        .forEach(s -> never.add(streamJson(s)));
                }
                case REALM_NAME -> state.put(key, realm.getName());
                case REALM_EMOJI -> state.set(key, emojiJson(realm));
                case REALM_FILTERS -> state.set(key, filtersJson(realm));
            }
        }
        return state;
    }

    private long maxMessageId(long userId) {
        return messages.values().stream()
            .filter(m -> m.getRecipients().contains(userId))
            .mapToLong(StoredMessage::getId)
            .max()
            .orElse(-1);
    }

    private List<Subscription> subscriptionsOf(long userId, boolean active) {
        return subscriptions.stream()
            .filter(s -> s.getUserId() == userId && s.isActive() == active)
            .toList();
    }

    synchronized ObjectNode personJson(UserProfile user) {
        return JsonUtils.object()
            .put("email", user.getEmail())
            .put("full_name", user.getFullName())
            .put("is_admin", user.isAdmin())
            .put("is_bot", user.isBot());
    }

    synchronized ObjectNode botJson(UserProfile bot) {
        UserProfile owner = bot.getBotOwnerId() == null ? null : users.get(bot.getBotOwnerId());
        return JsonUtils.object()
            .put("email", bot.getEmail())
            .put("full_name", bot.getFullName())
            .put("api_key", bot.getApiKey())
            .put("default_sending_stream", bot.getDefaultSendingStream())
            .put("default_events_register_stream", bot.getDefaultEventsRegisterStream())
            .put("default_all_public_streams", bot.isDefaultAllPublicStreams())
            .put("avatar_url", "/avatar/" + bot.getEmail())
            .put("owner", owner == null ? null : owner.getEmail());
    }

    synchronized ObjectNode streamJson(Stream stream) {
        return JsonUtils.object()
            .put("name", stream.getName())
            .put("stream_id", stream.getId())
            .put("description", stream.getDescription())
            .put("invite_only", stream.isInviteOnly())
            .put("email_address", streamEmail(stream));
    }

    synchronized ObjectNode subscriptionJson(Subscription subscription, boolean withSubscribers) {
        Stream stream = streams.get(subscription.getStreamId());
        ObjectNode json = streamJson(stream)
            .put("color", subscription.getColor())
            .put("in_home_view", subscription.isInHomeView())
            .put("desktop_notifications", subscription.isDesktopNotifications())
            .put("audible_notifications", subscription.isAudibleNotifications());
        if (withSubscribers) {
            json.set("subscribers", stringArray(subscriberEmails(stream.getId())));
        }
        return json;
    }

    /**
     * Sorted, so a list rebuilt from peer events compares equal.
     */
    synchronized List<String> subscriberEmails(long streamId) {
        return subscriberIds(streamId).stream()
            .map(id -> users.get(id).getEmail())
            .sorted()
            .toList();
    }

    synchronized String streamEmail(Stream stream) {
        String slug = stream.getName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug + "+" + stream.getEmailToken() + "@streams." + realm(stream.getRealmId()).getDomain();
    }

    synchronized ObjectNode emojiJson(Realm realm) {
        ObjectNode json = JsonUtils.object();
        realm.getEmoji().forEach((name, url) -> json.putObject(name)
            .put("source_url", url)
            .put("display_url", url));
        return json;
    }

    synchronized ArrayNode filtersJson(Realm realm) {
        ArrayNode json = JsonUtils.array();
        realm.getFilters().forEach(filter -> json.add(stringArray(filter)));
        return json;
    }

    synchronized ArrayNode mutedTopicsJson(UserProfile user) {
        ArrayNode json = JsonUtils.array();
        user.getMutedTopics().forEach(topic -> json.add(stringArray(topic)));
        return json;
    }

    static ArrayNode stringArray(Collection<String> values) {
        ArrayNode json = JsonUtils.array();
        values.forEach(json::add);
        return json;
    }
}
