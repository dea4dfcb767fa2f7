package com.qqsuccubus.longpoll.server.realm;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A human user or a bot.
 */
@Data
public class UserProfile {
    private final long id;
    private final long realmId;
    private final String email;
    private final boolean bot;
    private final Long botOwnerId;

    private String fullName;
    private boolean admin;
    private boolean active = true;
    private String apiKey;
    private long pointer = -1;

    private final List<String> alertWords = new ArrayList<>();
    // [stream name, topic] pairs
    private List<List<String>> mutedTopics = new ArrayList<>();

    // Stream names, not ids; renaming a stream does not rewrite them.
    private String defaultSendingStream;
    private String defaultEventsRegisterStream;
    private boolean defaultAllPublicStreams;
}
