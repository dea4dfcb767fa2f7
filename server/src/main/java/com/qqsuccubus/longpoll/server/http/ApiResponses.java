package com.qqsuccubus.longpoll.server.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.error.InvalidFilterException;
import com.qqsuccubus.longpoll.core.error.QueueNotFoundException;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.register.PrincipalNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerResponse;

/**
 * JSON envelopes for API responses and the mapping from exceptions to error responses.
 */
final class ApiResponses {
    private static final Logger log = LoggerFactory.getLogger(ApiResponses.class);

    static final String BAD_EVENT_QUEUE_ID = "BAD_EVENT_QUEUE_ID";
    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String UNAUTHORIZED = "UNAUTHORIZED";
    static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    private ApiResponses() {
    }

    static ObjectNode success() {
        return JsonUtils.object().put("result", "success").put("msg", "");
    }

    static Mono<Void> send(HttpServerResponse res, int status, ObjectNode body) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
            .then();
    }

    static Mono<Void> ok(HttpServerResponse res, ObjectNode body) {
        return send(res, 200, body);
    }

    static Mono<Void> error(HttpServerResponse res, Throwable err) {
        int status;
        String code;
        if (err instanceof QueueNotFoundException) {
            status = 400;
            code = BAD_EVENT_QUEUE_ID;
        } else if (err instanceof InvalidFilterException || err instanceof IllegalArgumentException) {
            status = 400;
            code = BAD_REQUEST;
        } else if (err instanceof PrincipalNotFoundException || err instanceof AuthenticationException) {
            status = 401;
            code = UNAUTHORIZED;
        } else {
            log.error("Unexpected error while handling request", err);
            status = 500;
            code = INTERNAL_SERVER_ERROR;
        }
        if (status != 500) {
            log.warn("Rejected request: {} ({})", err.getMessage(), code);
        }

        ObjectNode body = JsonUtils.object()
            .put("result", "error")
            .put("code", code)
            .put("msg", status == 500 ? "Internal server error" : err.getMessage());
        return send(res, status, body);
    }
}
