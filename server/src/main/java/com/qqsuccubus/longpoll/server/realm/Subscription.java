package com.qqsuccubus.longpoll.server.realm;

import lombok.Data;

/**
 * Membership of a user in a stream. Unsubscribing keeps the row, inactive.
 */
@Data
public class Subscription {
    private final long userId;
    private final long streamId;
    private boolean active = true;
    private String color;
    private boolean inHomeView = true;
    private boolean desktopNotifications;
    private boolean audibleNotifications;
}
