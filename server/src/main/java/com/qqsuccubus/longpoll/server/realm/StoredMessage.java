package com.qqsuccubus.longpoll.server.realm;

import lombok.Data;

import java.util.Set;

@Data
public class StoredMessage {
    public static final String STREAM = "stream";
    public static final String PRIVATE = "private";

    private final long id;
    private final long senderId;
    private final String type;
    private final Long streamId;
    private final String subject;
    private final Set<Long> recipients;
    private final long timestamp;
    private String content;
    private String renderedContent;
}
