package com.qqsuccubus.longpoll.server.client;

import com.qqsuccubus.longpoll.core.model.Narrow;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * What a client asked for when it registered, after defaults were resolved.
 */
@Value
@Builder(toBuilder = true)
public class ClientRegistration {
    long principalId;
    long realmId;

    // Wire names of wanted event types; empty means every type.
    @Builder.Default
    Set<String> eventTypes = Set.of();

    @Builder.Default
    String clientName = "unspecified";

    boolean applyMarkdown;
    boolean allPublicStreams;

    // Null falls back to the registry's configured idle lifetime.
    Duration lifespan;

    @Builder.Default
    Narrow narrow = Narrow.NONE;
}
