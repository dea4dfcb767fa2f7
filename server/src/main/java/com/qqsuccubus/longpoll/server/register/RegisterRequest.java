package com.qqsuccubus.longpoll.server.register;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.longpoll.core.model.Narrow;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A client's register call, before defaults are applied.
 */
@Value
@Builder(toBuilder = true)
public class RegisterRequest {

    @Builder.Default
    Set<String> eventTypes = Set.of();

    @Builder.Default
    Narrow narrow = Narrow.NONE;

    boolean applyMarkdown;

    // Null means "use the principal's default".
    Boolean allPublicStreams;

    @Builder.Default
    String clientName = "unspecified";

    Duration lifespan;

    /**
     * Reads the JSON body of a register call; absent fields keep their defaults.
     *
     * @throws IllegalArgumentException          if a field has the wrong shape
     * @throws com.qqsuccubus.longpoll.core.error.InvalidFilterException if the narrow is malformed
     */
    public static RegisterRequest fromJson(JsonNode body) {
        RegisterRequestBuilder builder = RegisterRequest.builder();
        if (body == null || body.isMissingNode() || body.isNull()) {
            return builder.build();
        }
        if (!body.isObject()) {
            throw new IllegalArgumentException("Register body must be a JSON object");
        }

        JsonNode types = body.path("event_types");
        if (!types.isMissingNode() && !types.isNull()) {
            if (!types.isArray()) {
                throw new IllegalArgumentException("event_types must be a list");
            }
            Set<String> eventTypes = new LinkedHashSet<>();
            types.forEach(type -> eventTypes.add(type.asText()));
            builder.eventTypes(eventTypes);
        }

        builder.narrow(Narrow.parse(body.get("narrow")));
        builder.applyMarkdown(body.path("apply_markdown").asBoolean(false));
        if (body.hasNonNull("all_public_streams")) {
            builder.allPublicStreams(body.get("all_public_streams").asBoolean());
        }
        if (body.hasNonNull("client")) {
            builder.clientName(body.get("client").asText());
        }
        if (body.hasNonNull("lifespan_secs")) {
            builder.lifespan(Duration.ofSeconds(body.get("lifespan_secs").asLong()));
        }
        return builder.build();
    }
}
