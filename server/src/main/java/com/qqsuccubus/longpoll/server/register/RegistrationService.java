package com.qqsuccubus.longpoll.server.register;

import com.qqsuccubus.longpoll.core.model.Narrow;
import com.qqsuccubus.longpoll.core.state.Snapshot;
import com.qqsuccubus.longpoll.core.state.StateReconciler;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.client.ClientRegistration;
import com.qqsuccubus.longpoll.server.registry.IQueueRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers clients: resolves defaults, allocates a queue and fetches the initial state.
 * <p>
 * The queue is allocated before the snapshot is fetched; an event emitted in between lands in
 * the queue and may also be reflected in the snapshot, and every transform tolerates that.
 * </p>
 */
@RequiredArgsConstructor
public class RegistrationService {
    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final IQueueRegistry registry;
    private final StateReconciler reconciler;
    private final PrincipalDirectory principals;

    public Registration register(long principalId, RegisterRequest request) {
        long realmId = principals.realmOf(principalId);
        ClientRegistration registration = resolve(principalId, realmId, request);

        ClientDescriptor descriptor = registry.allocate(registration);
        Snapshot state = reconciler.snapshot(principalId, registration.getEventTypes(), registration.getNarrow());

        log.debug("Registered queue {} with sections {}", descriptor.getQueueId(), state.sections());
        return new Registration(descriptor.getQueueId(), -1, state);
    }

    public void unregister(String queueId, long principalId) {
        registry.remove(queueId, principalId);
    }

    ClientRegistration resolve(long principalId, long realmId, RegisterRequest request) {
        boolean allPublicStreams = request.getAllPublicStreams() != null
            ? request.getAllPublicStreams()
            : principals.defaultAllPublicStreams(principalId);

        Narrow narrow = request.getNarrow();
        if (narrow.isEmpty()) {
            narrow = principals.defaultEventsRegisterStream(principalId)
                .map(Narrow::stream)
                .orElse(Narrow.NONE);
        }

        return ClientRegistration.builder()
            .principalId(principalId)
            .realmId(realmId)
            .eventTypes(request.getEventTypes())
            .clientName(request.getClientName())
            .applyMarkdown(request.isApplyMarkdown())
            .allPublicStreams(allPublicStreams)
            .lifespan(request.getLifespan())
            .narrow(narrow)
            .build();
    }
}
