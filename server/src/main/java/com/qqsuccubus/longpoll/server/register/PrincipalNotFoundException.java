package com.qqsuccubus.longpoll.server.register;

import com.qqsuccubus.longpoll.core.error.EventQueueException;
import lombok.Getter;

@Getter
public class PrincipalNotFoundException extends EventQueueException {
    private final long principalId;

    public PrincipalNotFoundException(long principalId) {
        super("Unknown or inactive principal: " + principalId);
        this.principalId = principalId;
    }
}
