package com.qqsuccubus.longpoll.server.realm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.dispatch.EventEmitter;
import com.qqsuccubus.longpoll.server.dispatch.Notice;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Domain actions on the in-memory realm. Each one changes the store and emits the events that
 * describe the change, as a single batch, while holding the store's monitor.
 */
@RequiredArgsConstructor
public class RealmActions {
    private static final Logger log = LoggerFactory.getLogger(RealmActions.class);

    private final RealmStore store;
    private final EventEmitter emitter;
    private final Clock clock;

    public RealmStore getStore() {
        return store;
    }

    /**
     * Sends a message to a stream; the stream must exist.
     *
     * @param senderQueueId queue of the sending client, or null
     * @param localId       id the sending client gave the message locally, or null
     * @return the new message id
     */
    public long sendStreamMessage(long senderId, String streamName, String subject, String content,
                                  String senderQueueId, String localId) {
        synchronized (store) {
            UserProfile sender = store.user(senderId);
            Stream stream = store.streamByName(sender.getRealmId(), streamName)
                .orElseThrow(() -> new IllegalArgumentException("Stream '" + streamName + "' does not exist"));

            Set<Long> recipients = new LinkedHashSet<>(store.subscriberIds(stream.getId()));
            recipients.add(senderId);
            StoredMessage message = store.addMessage(senderId, StoredMessage.STREAM, stream.getId(),
                subject, recipients, clock.instant().getEpochSecond());

            ObjectNode messageJson = storeContent(message, content, sender)
                .put("display_recipient", stream.getName());
            emit(Notice.builder()
                .event(messageEvent(messageJson))
                .recipients(recipients)
                .publicStreamRealmId(stream.isInviteOnly() ? null : stream.getRealmId())
                .senderQueueId(senderQueueId)
                .localMessageId(localId)
                .build());
            return message.getId();
        }
    }

    /**
     * Sends a private message to the given users.
     *
     * @return the new message id
     */
    public long sendPrivateMessage(long senderId, Collection<String> recipientEmails, String content,
                                   String senderQueueId, String localId) {
        synchronized (store) {
            UserProfile sender = store.user(senderId);
            if (recipientEmails.isEmpty()) {
                throw new IllegalArgumentException("Private message needs at least one recipient");
            }

            TreeMap<String, UserProfile> participants = new TreeMap<>();
            participants.put(sender.getEmail(), sender);
            for (String email : recipientEmails) {
                UserProfile recipient = store.userByEmail(email)
                    .filter(u -> u.isActive() && u.getRealmId() == sender.getRealmId())
                    .orElseThrow(() -> new IllegalArgumentException("Invalid recipient: " + email));
                participants.put(recipient.getEmail(), recipient);
            }

            Set<Long> recipients = new LinkedHashSet<>();
            participants.values().forEach(u -> recipients.add(u.getId()));
            StoredMessage message = store.addMessage(senderId, StoredMessage.PRIVATE, null,
                "", recipients, clock.instant().getEpochSecond());

            ObjectNode messageJson = storeContent(message, content, sender);
            ArrayNode displayRecipient = messageJson.putArray("display_recipient");
            participants.values().forEach(u -> displayRecipient.addObject()
                .put("email", u.getEmail())
                .put("full_name", u.getFullName()));

            emit(Notice.builder()
                .event(messageEvent(messageJson))
                .recipients(recipients)
                .senderQueueId(senderQueueId)
                .localMessageId(localId)
                .build());
            return message.getId();
        }
    }

    private ObjectNode storeContent(StoredMessage message, String content, UserProfile sender) {
        message.setContent(content);
        message.setRenderedContent(render(content));
        return JsonUtils.object()
            .put("id", message.getId())
            .put("sender_id", sender.getId())
            .put("sender_email", sender.getEmail())
            .put("sender_full_name", sender.getFullName())
            .put("type", message.getType())
            .put("subject", message.getSubject())
            .put("timestamp", message.getTimestamp())
            .put("content", message.getContent())
            .put("rendered_content", message.getRenderedContent());
    }

    private static Event messageEvent(ObjectNode messageJson) {
        ObjectNode fields = JsonUtils.object();
        fields.set("message", messageJson);
        fields.putArray("flags");
        return Event.of(EventType.MESSAGE, fields);
    }

    /**
     * Replaces the content of a message; only its sender may edit it.
     */
    public void editMessage(long userId, long messageId, String content) {
        synchronized (store) {
            StoredMessage message = store.message(messageId);
            if (message.getSenderId() != userId) {
                throw new IllegalArgumentException("You don't have permission to edit this message");
            }
            ObjectNode fields = JsonUtils.object()
                .put("message_id", messageId)
                .put("sender", store.user(userId).getEmail())
                .put("orig_content", message.getContent())
                .put("orig_rendered_content", message.getRenderedContent())
                .put("content", content)
                .put("rendered_content", render(content))
                .put("edit_timestamp", clock.instant().getEpochSecond());
            message.setContent(content);
            message.setRenderedContent(render(content));
            emit(EventType.UPDATE_MESSAGE, fields, message.getRecipients());
        }
    }

    /**
     * Moves the pointer forward; a pointer at or behind the current one is ignored.
     *
     * @return true if the pointer moved
     */
    public boolean updatePointer(long userId, long pointer) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            if (pointer <= user.getPointer()) {
                return false;
            }
            user.setPointer(pointer);
            emit(EventType.POINTER, JsonUtils.object().put("pointer", pointer), Set.of(userId));
            return true;
        }
    }

    /**
     * Adds or removes a per-user flag (read, starred, ...) on messages.
     */
    public void updateMessageFlags(long userId, String operation, String flag, List<Long> messageIds, boolean all) {
        if (!"add".equals(operation) && !"remove".equals(operation)) {
            throw new IllegalArgumentException("Invalid message flag operation: " + operation);
        }
        synchronized (store) {
            store.user(userId);
            ObjectNode fields = JsonUtils.object()
                .put("operation", operation)
                .put("flag", flag)
                .put("all", all);
            ArrayNode messages = fields.putArray("messages");
            messageIds.forEach(messages::add);
            emit(EventType.UPDATE_MESSAGE_FLAGS, fields, Set.of(userId));
        }
    }

    public UserProfile createUser(long realmId, String email, String fullName) {
        synchronized (store) {
            UserProfile user = store.addUser(realmId, email, fullName, false, null);
            emit(realmUserNotice("add", store.personJson(user), realmId));
            log.info("Created user {} in realm {}", email, realmId);
            return user;
        }
    }

    public UserProfile createBot(long ownerId, String email, String fullName) {
        synchronized (store) {
            UserProfile owner = store.user(ownerId);
            UserProfile bot = store.addUser(owner.getRealmId(), email, fullName, true, ownerId);
            emit(List.of(
                realmUserNotice("add", store.personJson(bot), owner.getRealmId()),
                realmBotNotice("add", store.botJson(bot), ownerId)));
            log.info("Created bot {} owned by {}", email, owner.getEmail());
            return bot;
        }
    }

    /**
     * Deactivates a user or bot. Subscribers of its streams get peer removals, since the user no
     * longer counts as a subscriber.
     */
    public void deactivateUser(long userId) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            if (!user.isActive()) {
                return;
            }
            List<Stream> subscribed = store.activeSubscriptionsOf(userId).stream()
                .map(s -> store.stream(s.getStreamId()))
                .toList();
            user.setActive(false);

            List<Notice> batch = new ArrayList<>();
            ObjectNode person = JsonUtils.object()
                .put("email", user.getEmail())
                .put("full_name", user.getFullName());
            batch.add(realmUserNotice("remove", person, user.getRealmId()));
            if (user.isBot() && user.getBotOwnerId() != null) {
                batch.add(realmBotNotice("remove", person.deepCopy(), user.getBotOwnerId()));
            }
            for (Stream stream : subscribed) {
                batch.add(peerNotice("peer_remove", user, stream));
            }
            emit(batch);
            log.info("Deactivated user {}", user.getEmail());
        }
    }

    public void changeFullName(long userId, String fullName) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            user.setFullName(fullName);

            List<Notice> batch = new ArrayList<>();
            batch.add(realmUserNotice("update", JsonUtils.object()
                .put("email", user.getEmail())
                .put("full_name", fullName), user.getRealmId()));
            if (user.isBot() && user.getBotOwnerId() != null) {
                batch.add(realmBotNotice("update", JsonUtils.object()
                    .put("email", user.getEmail())
                    .put("full_name", fullName), user.getBotOwnerId()));
            }
            emit(batch);
        }
    }

    /**
     * Sets the admin flag. The event is sent even when the flag does not change.
     */
    public void changeIsAdmin(long userId, boolean admin) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            user.setAdmin(admin);
            emit(realmUserNotice("update", JsonUtils.object()
                .put("email", user.getEmail())
                .put("is_admin", admin), user.getRealmId()));
        }
    }

    /**
     * @return the new API key
     */
    public String regenerateApiKey(long userId) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            user.setApiKey(RealmStore.newApiKey());
            if (user.isBot() && user.getBotOwnerId() != null) {
                emit(realmBotNotice("update", JsonUtils.object()
                    .put("email", user.getEmail())
                    .put("api_key", user.getApiKey()), user.getBotOwnerId()));
            }
            return user.getApiKey();
        }
    }

    public void changeDefaultAllPublicStreams(long userId, boolean allPublicStreams) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            user.setDefaultAllPublicStreams(allPublicStreams);
            if (user.isBot() && user.getBotOwnerId() != null) {
                emit(realmBotNotice("update", JsonUtils.object()
                    .put("email", user.getEmail())
                    .put("default_all_public_streams", allPublicStreams), user.getBotOwnerId()));
            }
        }
    }

    /**
     * @param streamName stream new queues are narrowed to by default, or null to clear it
     */
    public void changeDefaultEventsRegisterStream(long userId, String streamName) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            String name = streamName == null ? null : requireStream(user.getRealmId(), streamName).getName();
            user.setDefaultEventsRegisterStream(name);
            if (user.isBot() && user.getBotOwnerId() != null) {
                emit(realmBotNotice("update", JsonUtils.object()
                    .put("email", user.getEmail())
                    .put("default_events_register_stream", name), user.getBotOwnerId()));
            }
        }
    }

    public void setRealmName(long realmId, String name) {
        synchronized (store) {
            store.realm(realmId).setName(name);
            emit(EventType.REALM, JsonUtils.object()
                .put("op", "update")
                .put("property", "name")
                .put("value", name), store.activeUserIds(realmId));
        }
    }

    public void addRealmEmoji(long realmId, String name, String imageUrl) {
        synchronized (store) {
            Realm realm = store.realm(realmId);
            realm.getEmoji().put(name, imageUrl);
            notifyRealmEmoji(realm);
        }
    }

    public void removeRealmEmoji(long realmId, String name) {
        synchronized (store) {
            Realm realm = store.realm(realmId);
            if (realm.getEmoji().remove(name) == null) {
                throw new IllegalArgumentException("Emoji '" + name + "' does not exist");
            }
            notifyRealmEmoji(realm);
        }
    }

    private void notifyRealmEmoji(Realm realm) {
        ObjectNode fields = JsonUtils.object().put("op", "update");
        fields.set("realm_emoji", store.emojiJson(realm));
        emit(EventType.REALM_EMOJI, fields, store.activeUserIds(realm.getId()));
    }

    public void addRealmFilter(long realmId, String pattern, String urlFormat) {
        synchronized (store) {
            Realm realm = store.realm(realmId);
            if (realm.getFilters().stream().anyMatch(f -> f.get(0).equals(pattern))) {
                throw new IllegalArgumentException("Filter '" + pattern + "' already exists");
            }
            realm.getFilters().add(List.of(pattern, urlFormat));
            notifyRealmFilters(realm);
        }
    }

    public void removeRealmFilter(long realmId, String pattern) {
        synchronized (store) {
            Realm realm = store.realm(realmId);
            if (!realm.getFilters().removeIf(f -> f.get(0).equals(pattern))) {
                throw new IllegalArgumentException("Filter '" + pattern + "' does not exist");
            }
            notifyRealmFilters(realm);
        }
    }

    private void notifyRealmFilters(Realm realm) {
        ObjectNode fields = JsonUtils.object();
        fields.set("realm_filters", store.filtersJson(realm));
        emit(EventType.REALM_FILTERS, fields, store.activeUserIds(realm.getId()));
    }

    public void addAlertWords(long userId, Collection<String> words) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            for (String word : words) {
                if (!user.getAlertWords().contains(word)) {
                    user.getAlertWords().add(word);
                }
            }
            notifyAlertWords(user);
        }
    }

    public void removeAlertWords(long userId, Collection<String> words) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            user.getAlertWords().removeAll(words);
            notifyAlertWords(user);
        }
    }

    private void notifyAlertWords(UserProfile user) {
        ObjectNode fields = JsonUtils.object();
        fields.set("alert_words", RealmStore.stringArray(user.getAlertWords()));
        emit(EventType.ALERT_WORDS, fields, Set.of(user.getId()));
    }

    /**
     * @param topics [stream name, topic] pairs
     */
    public void setMutedTopics(long userId, List<List<String>> topics) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            List<List<String>> copy = new ArrayList<>();
            for (List<String> topic : topics) {
                if (topic.size() != 2) {
                    throw new IllegalArgumentException("Muted topic must be [stream, topic]: " + topic);
                }
                copy.add(List.copyOf(topic));
            }
            user.setMutedTopics(copy);
            ObjectNode fields = JsonUtils.object();
            fields.set("muted_topics", store.mutedTopicsJson(user));
            emit(EventType.MUTED_TOPICS, fields, Set.of(userId));
        }
    }

    /**
     * Creates a stream unless one with the same name (case-insensitively) exists.
     *
     * @return the new or existing stream
     */
    public Stream createStream(long realmId, String name, String description, boolean inviteOnly) {
        synchronized (store) {
            List<Notice> batch = new ArrayList<>();
            Stream stream = createStreamIfNeeded(realmId, name, description, inviteOnly, batch);
            emit(batch);
            return stream;
        }
    }

    private Stream createStreamIfNeeded(long realmId, String name, String description, boolean inviteOnly,
                                        List<Notice> batch) {
        Optional<Stream> existing = store.streamByName(realmId, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Stream stream = store.addStream(realmId, name, description, inviteOnly);
        if (!inviteOnly) {
            ObjectNode fields = JsonUtils.object().put("op", "create");
            fields.putArray("streams").add(store.streamJson(stream));
            batch.add(Notice.of(Event.of(EventType.STREAM, fields), store.activeUserIds(realmId)));
        }
        log.info("Created stream '{}' in realm {}", name, realmId);
        return stream;
    }

    /**
     * Subscribes a user, creating a public stream if there is none with this name.
     *
     * @return false if the user was already subscribed
     */
    public boolean subscribe(long userId, String streamName) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            List<Notice> batch = new ArrayList<>();
            Stream stream = createStreamIfNeeded(user.getRealmId(), streamName, "", false, batch);

            Optional<Subscription> existing = store.subscription(userId, stream.getId());
            if (existing.isPresent() && existing.get().isActive()) {
                emit(batch);
                return false;
            }
            Set<Long> peers = store.subscriberIds(stream.getId());
            Subscription subscription = existing.orElseGet(() -> store.addSubscription(userId, stream.getId()));
            subscription.setActive(true);

            ObjectNode added = JsonUtils.object().put("op", "add");
            added.putArray("subscriptions").add(store.subscriptionJson(subscription, true));
            batch.add(Notice.of(Event.of(EventType.SUBSCRIPTION, added), Set.of(userId)));
            if (!peers.isEmpty()) {
                batch.add(peerNotice("peer_add", user, stream, peers));
            }
            emit(batch);
            return true;
        }
    }

    /**
     * @return false if the user was not subscribed
     */
    public boolean unsubscribe(long userId, String streamName) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            Stream stream = requireStream(user.getRealmId(), streamName);
            Optional<Subscription> subscription = store.subscription(userId, stream.getId())
                .filter(Subscription::isActive);
            if (subscription.isEmpty()) {
                return false;
            }
            subscription.get().setActive(false);

            List<Notice> batch = new ArrayList<>();
            ObjectNode removed = JsonUtils.object().put("op", "remove");
            removed.putArray("subscriptions").addObject()
                .put("name", stream.getName())
                .put("stream_id", stream.getId());
            batch.add(Notice.of(Event.of(EventType.SUBSCRIPTION, removed), Set.of(userId)));
            if (!store.subscriberIds(stream.getId()).isEmpty()) {
                batch.add(peerNotice("peer_remove", user, stream));
            }
            emit(batch);
            return true;
        }
    }

    /**
     * Renames a stream. Clients learn the new email address first, then the new name, both keyed
     * by the old name.
     */
    public void renameStream(long realmId, String oldName, String newName) {
        synchronized (store) {
            Stream stream = requireStream(realmId, oldName);
            Optional<Stream> clash = store.streamByName(realmId, newName);
            if (clash.isPresent() && clash.get().getId() != stream.getId()) {
                throw new IllegalArgumentException("Stream name '" + newName + "' is already in use");
            }
            String previousName = stream.getName();
            stream.setName(newName);

            Set<Long> audience = streamAudience(stream);
            emit(List.of(
                streamUpdateNotice(previousName, "email_address",
                    TextNode.valueOf(store.streamEmail(stream)), audience),
                streamUpdateNotice(previousName, "name",
                    TextNode.valueOf(newName), audience)));
            log.info("Renamed stream '{}' to '{}'", previousName, newName);
        }
    }

    public void changeStreamDescription(long realmId, String streamName, String description) {
        synchronized (store) {
            Stream stream = requireStream(realmId, streamName);
            stream.setDescription(description);
            emit(streamUpdateNotice(stream.getName(), "description",
                TextNode.valueOf(description), streamAudience(stream)));
        }
    }

    /**
     * Changes one of the user's own settings for a stream: {@code color}, {@code in_home_view},
     * {@code desktop_notifications} or {@code audible_notifications}.
     */
    public void changeSubscriptionProperty(long userId, String streamName, String property, JsonNode value) {
        synchronized (store) {
            UserProfile user = store.user(userId);
            Stream stream = requireStream(user.getRealmId(), streamName);
            Subscription subscription = store.subscription(userId, stream.getId())
                .filter(Subscription::isActive)
                .orElseThrow(() -> new IllegalArgumentException("Not subscribed to '" + streamName + "'"));

            switch (property) {
                case "color" -> subscription.setColor(value.asText());
                case "in_home_view" -> subscription.setInHomeView(value.asBoolean());
                case "desktop_notifications" -> subscription.setDesktopNotifications(value.asBoolean());
                case "audible_notifications" -> subscription.setAudibleNotifications(value.asBoolean());
                default -> throw new IllegalArgumentException("Unknown subscription property: " + property);
            }

            ObjectNode fields = JsonUtils.object()
                .put("op", "update")
                .put("name", stream.getName())
                .put("property", property);
            fields.set("value", store.subscriptionJson(subscription, false).get(property));
            emit(EventType.SUBSCRIPTION, fields, Set.of(userId));
        }
    }

    private Stream requireStream(long realmId, String name) {
        return store.streamByName(realmId, name)
            .orElseThrow(() -> new IllegalArgumentException("Stream '" + name + "' does not exist"));
    }

    // Public streams are visible realm-wide; private ones to current and former subscribers.
    private Set<Long> streamAudience(Stream stream) {
        return stream.isInviteOnly() ? store.memberIds(stream.getId()) : store.activeUserIds(stream.getRealmId());
    }

    private Notice streamUpdateNotice(String name, String property, JsonNode value, Set<Long> audience) {
        ObjectNode fields = JsonUtils.object()
            .put("op", "update")
            .put("name", name)
            .put("property", property);
        fields.set("value", value);
        return Notice.of(Event.of(EventType.STREAM, fields), audience);
    }

    private Notice realmUserNotice(String op, ObjectNode person, long realmId) {
        ObjectNode fields = JsonUtils.object().put("op", op);
        fields.set("person", person);
        return Notice.of(Event.of(EventType.REALM_USER, fields), store.activeUserIds(realmId));
    }

    private Notice realmBotNotice(String op, ObjectNode bot, long ownerId) {
        ObjectNode fields = JsonUtils.object().put("op", op);
        fields.set("bot", bot);
        return Notice.of(Event.of(EventType.REALM_BOT, fields), Set.of(ownerId));
    }

    private Notice peerNotice(String op, UserProfile peer, Stream stream) {
        return peerNotice(op, peer, stream, store.subscriberIds(stream.getId()));
    }

    private Notice peerNotice(String op, UserProfile peer, Stream stream, Set<Long> recipients) {
        ObjectNode fields = JsonUtils.object()
            .put("op", op)
            .put("user_email", peer.getEmail());
        fields.putArray("subscriptions").add(stream.getName());
        return Notice.of(Event.of(EventType.SUBSCRIPTION, fields), recipients);
    }

    private void emit(EventType type, ObjectNode fields, Set<Long> recipients) {
        emit(Notice.of(Event.of(type, fields), recipients));
    }

    private void emit(Notice notice) {
        emit(List.of(notice));
    }

    private void emit(List<Notice> batch) {
        List<Notice> deliverable = batch.stream().filter(n -> !n.getRecipients().isEmpty()).toList();
        if (!deliverable.isEmpty()) {
            emitter.emit(deliverable);
        }
    }

    /**
     * Minimal renderer: escapes HTML and wraps the text in a paragraph.
     */
    static String render(String content) {
        StringBuilder html = new StringBuilder("<p>");
        for (char c : content.toCharArray()) {
            switch (c) {
                case '&' -> html.append("&amp;");
                case '<' -> html.append("&lt;");
                case '>' -> html.append("&gt;");
                case '"' -> html.append("&quot;");
                default -> html.append(c);
            }
        }
        return html.append("</p>").toString();
    }
}
