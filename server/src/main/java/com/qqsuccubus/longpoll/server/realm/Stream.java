package com.qqsuccubus.longpoll.server.realm;

import lombok.Data;

@Data
public class Stream {
    private final long id;
    private final long realmId;
    private final String emailToken;
    private String name;
    private String description;
    private boolean inviteOnly;
}
