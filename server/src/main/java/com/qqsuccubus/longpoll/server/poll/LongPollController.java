package com.qqsuccubus.longpoll.server.poll;

import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.metrics.MetricsService;
import com.qqsuccubus.longpoll.server.registry.IQueueRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Serves long-poll requests.
 * <p>
 * A poll first acknowledges everything up to {@code lastEventId}. If events are queued after
 * it, or the client asked not to block, it returns at once. Otherwise it waits without
 * holding a thread until a dispatch adds an event or the timeout elapses; a timeout is a
 * normal, possibly empty, result. Cancelling the returned {@link Mono} (e.g. because the
 * HTTP client went away) ends the wait and leaves the queue untouched.
 * </p>
 */
@RequiredArgsConstructor
public class LongPollController {
    private static final Logger log = LoggerFactory.getLogger(LongPollController.class);

    private final IQueueRegistry registry;
    private final ServerConfig config;
    private final MetricsService metricsService;
    private final Clock clock;

    public Mono<PollResult> poll(PollRequest request) {
        return Mono.defer(() -> {
            ClientDescriptor client = registry.lookup(request.getQueueId(), request.getPrincipalId());
            client.touch(clock.instant());

            long lastEventId = request.getLastEventId();
            if (lastEventId >= 0) {
                client.prune(lastEventId);
            }

            List<Event> ready = client.eventsAfter(lastEventId);
            if (!ready.isEmpty() || request.isDontBlock()) {
                return Mono.just(new PollResult(client.getQueueId(), ready, PollOutcome.IMMEDIATE));
            }

            Duration timeout = request.getTimeout() != null ? request.getTimeout() : config.getPollTimeout();
            log.debug("Poll on queue {} waiting up to {} after event {}", client.getQueueId(), timeout, lastEventId);
            return client.awaitEvents(lastEventId)
                .map(events -> new PollResult(client.getQueueId(), events, PollOutcome.WOKEN))
                .switchIfEmpty(Mono.fromSupplier(() ->
                    new PollResult(client.getQueueId(), client.eventsAfter(lastEventId), PollOutcome.CLOSED)))
                .timeout(timeout, Mono.fromSupplier(() ->
                    new PollResult(client.getQueueId(), client.eventsAfter(lastEventId), PollOutcome.TIMEOUT)))
                .doFinally(signal -> client.touch(clock.instant()));
        }).doOnNext(result -> {
            metricsService.recordPoll(result.getOutcome());
            log.debug("Poll on queue {} returned {} events ({})",
                result.getQueueId(), result.getEvents().size(), result.getOutcome());
        });
    }
}
