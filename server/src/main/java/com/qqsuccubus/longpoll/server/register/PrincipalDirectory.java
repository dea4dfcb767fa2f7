package com.qqsuccubus.longpoll.server.register;

import java.util.Optional;

/**
 * Per-principal facts the registration path needs from the domain.
 */
public interface PrincipalDirectory {

    /**
     * @throws PrincipalNotFoundException if there is no active principal with this id
     */
    long realmOf(long principalId);

    boolean defaultAllPublicStreams(long principalId);

    /**
     * Stream new queues of this principal are narrowed to when the client sends no narrow.
     */
    Optional<String> defaultEventsRegisterStream(long principalId);
}
