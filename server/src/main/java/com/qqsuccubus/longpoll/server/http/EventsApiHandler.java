package com.qqsuccubus.longpoll.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.poll.LongPollController;
import com.qqsuccubus.longpoll.server.poll.PollRequest;
import com.qqsuccubus.longpoll.server.poll.PollResult;
import com.qqsuccubus.longpoll.server.realm.RealmActions;
import com.qqsuccubus.longpoll.server.register.RegisterRequest;
import com.qqsuccubus.longpoll.server.register.RegistrationService;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Handlers for the {@code /api/v1} routes. The caller is identified by the {@value #PRINCIPAL_HEADER} header.
 */
@RequiredArgsConstructor
public class EventsApiHandler {
    public static final String PRINCIPAL_HEADER = "X-User-Id";

    private final RegistrationService registrationService;
    private final LongPollController pollController;
    private final RealmActions realmActions;

    public Mono<Void> register(HttpServerRequest req, HttpServerResponse res) {
        return body(req)
            .map(body -> registrationService.register(principal(req), RegisterRequest.fromJson(body)))
            .flatMap(registration -> {
                ObjectNode json = ApiResponses.success();
                json.setAll(registration.toJson());
                return ApiResponses.ok(res, json);
            })
            .onErrorResume(err -> ApiResponses.error(res, err));
    }

    /**
     * Long-polls a queue. If the client goes away the response publisher is cancelled, which
     * ends the wait.
     */
    public Mono<Void> getEvents(HttpServerRequest req, HttpServerResponse res) {
        return Mono.fromCallable(() -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                return PollRequest.builder()
                    .principalId(principal(req))
                    .queueId(param(decoder, "queue_id").orElse(null))
                    .lastEventId(param(decoder, "last_event_id").map(Long::parseLong).orElse(-1L))
                    .dontBlock(param(decoder, "dont_block").map(Boolean::parseBoolean).orElse(false))
                    .build();
            })
            .flatMap(pollController::poll)
            .flatMap(result -> ApiResponses.ok(res, pollJson(result)))
            .onErrorResume(err -> ApiResponses.error(res, err));
    }

    public Mono<Void> deleteQueue(HttpServerRequest req, HttpServerResponse res) {
        return Mono.fromRunnable(() -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                registrationService.unregister(param(decoder, "queue_id").orElse(null), principal(req));
            })
            .then(Mono.defer(() -> ApiResponses.ok(res, ApiResponses.success())))
            .onErrorResume(err -> ApiResponses.error(res, err));
    }

    /**
     * Body: {@code {"type": "stream"|"private", "to": ..., "subject": ..., "content": ...,
     * "queue_id": ..., "local_id": ...}}. For private messages {@code to} is an email or a list of them.
     */
    public Mono<Void> sendMessage(HttpServerRequest req, HttpServerResponse res) {
        return body(req)
            .map(body -> {
                long sender = principal(req);
                String content = required(body, "content").asText();
                String queueId = body.hasNonNull("queue_id") ? body.get("queue_id").asText() : null;
                String localId = body.hasNonNull("local_id") ? body.get("local_id").asText() : null;
                String type = required(body, "type").asText();
                return switch (type) {
                    case "stream" -> realmActions.sendStreamMessage(sender, required(body, "to").asText(),
                        required(body, "subject").asText(), content, queueId, localId);
                    case "private" -> realmActions.sendPrivateMessage(sender, emails(required(body, "to")),
                        content, queueId, localId);
                    default -> throw new IllegalArgumentException("Invalid message type: " + type);
                };
            })
            .flatMap(id -> ApiResponses.ok(res, ApiResponses.success().put("id", id)))
            .onErrorResume(err -> ApiResponses.error(res, err));
    }

    public Mono<Void> updatePointer(HttpServerRequest req, HttpServerResponse res) {
        return body(req)
            .map(body -> {
                JsonNode pointer = required(body, "pointer");
                if (!pointer.canConvertToLong()) {
                    throw new IllegalArgumentException("pointer must be an integer");
                }
                realmActions.updatePointer(principal(req), pointer.asLong());
                return ApiResponses.success();
            })
            .flatMap(json -> ApiResponses.ok(res, json))
            .onErrorResume(err -> ApiResponses.error(res, err));
    }

    private static ObjectNode pollJson(PollResult result) {
        ObjectNode json = ApiResponses.success().put("queue_id", result.getQueueId());
        ArrayNode events = json.putArray("events");
        result.getEvents().forEach(event -> events.add(event.toJson()));
        return json;
    }

    private static Mono<JsonNode> body(HttpServerRequest req) {
        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .map(text -> text.isBlank() ? MissingNode.getInstance() : JsonUtils.readTree(text));
    }

    static long principal(HttpServerRequest req) {
        String header = req.requestHeaders().get(PRINCIPAL_HEADER);
        if (header == null || header.isBlank()) {
            throw new AuthenticationException("Missing " + PRINCIPAL_HEADER + " header");
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw new AuthenticationException("Invalid " + PRINCIPAL_HEADER + " header: " + header);
        }
    }

    private static Optional<String> param(QueryStringDecoder decoder, String name) {
        return Stream.ofNullable(decoder.parameters().get(name))
            .flatMap(Collection::stream)
            .findFirst();
    }

    private static JsonNode required(JsonNode body, String field) {
        JsonNode value = body.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new IllegalArgumentException("Missing '" + field + "' argument");
        }
        return value;
    }

    private static List<String> emails(JsonNode to) {
        List<String> emails = new ArrayList<>();
        if (to.isArray()) {
            to.forEach(email -> emails.add(email.asText()));
        } else {
            for (String email : to.asText().split(",")) {
                if (!email.isBlank()) {
                    emails.add(email.trim());
                }
            }
        }
        return emails;
    }
}
