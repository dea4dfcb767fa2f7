package com.qqsuccubus.longpoll.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.qqsuccubus.longpoll.core.error.InvalidFilterException;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Message filter a client registers with: a conjunction of {@code [operator, operand]} terms.
 * <p>
 * Supported operators:
 * <ul>
 *   <li>{@code stream}: stream messages whose display recipient equals the operand</li>
 *   <li>{@code topic}: messages whose subject equals the operand</li>
 *   <li>{@code sender}: messages sent by the given email</li>
 *   <li>{@code is:private}: private messages</li>
 * </ul>
 * All comparisons ignore case. An empty narrow matches every message.
 * </p>
 */
@Value
public class Narrow {
    public static final Narrow NONE = new Narrow(List.of());

    public static final String STREAM = "stream";
    public static final String TOPIC = "topic";
    public static final String SENDER = "sender";
    public static final String IS = "is";

    private static final Set<String> OPERATORS = Set.of(STREAM, TOPIC, SENDER, IS);

    List<Term> terms;

    /**
     * One {@code [operator, operand]} pair.
     */
    @Value
    public static class Term {
        String operator;
        String operand;

        @JsonValue
        public List<String> toJson() {
            return List.of(operator, operand);
        }
    }

    public Narrow(List<Term> terms) {
        this.terms = List.copyOf(terms);
    }

    public static Narrow stream(String streamName) {
        return new Narrow(List.of(new Term(STREAM, streamName)));
    }

    /**
     * Parses {@code [["stream", "denmark"], ["topic", "x"]]}; {@code null} or JSON null is an empty narrow.
     *
     * @throws InvalidFilterException on any shape or operator problem
     */
    public static Narrow parse(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return NONE;
        }
        if (!json.isArray()) {
            throw new InvalidFilterException("Narrow must be a list of [operator, operand] pairs");
        }
        List<Term> terms = new ArrayList<>();
        for (JsonNode element : json) {
            if (!element.isArray() || element.size() != 2
                || !element.get(0).isTextual() || !element.get(1).isTextual()) {
                throw new InvalidFilterException("Invalid narrow element: " + element);
            }
            terms.add(term(element.get(0).asText(), element.get(1).asText()));
        }
        return new Narrow(terms);
    }

    public static Term term(String operator, String operand) {
        if (!OPERATORS.contains(operator)) {
            throw new InvalidFilterException("Unknown narrow operator: " + operator);
        }
        if (IS.equals(operator) && !"private".equalsIgnoreCase(operand)) {
            throw new InvalidFilterException("Unsupported narrow is: " + operand);
        }
        return new Term(operator, operand);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * Stream operands referenced by this narrow; they must exist when a client registers.
     */
    public List<String> streamNames() {
        return terms.stream()
            .filter(t -> STREAM.equals(t.getOperator()))
            .map(Term::getOperand)
            .toList();
    }

    public Optional<String> streamName() {
        return streamNames().stream().findFirst();
    }

    /**
     * Tests the {@code message} object of a message event.
     */
    public boolean matches(JsonNode message) {
        for (Term term : terms) {
            if (!matches(term, message)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(Term term, JsonNode message) {
        String operand = term.getOperand();
        return switch (term.getOperator()) {
            case STREAM -> "stream".equals(message.path("type").asText())
                && operand.equalsIgnoreCase(message.path("display_recipient").asText());
            case TOPIC -> operand.equalsIgnoreCase(message.path("subject").asText());
            case SENDER -> operand.equalsIgnoreCase(message.path("sender_email").asText());
            case IS -> "private".equals(message.path("type").asText());
            default -> false;
        };
    }

    @JsonValue
    public ArrayNode toJson() {
        ArrayNode json = JsonUtils.array();
        terms.forEach(t -> json.addArray().add(t.getOperator()).add(t.getOperand()));
        return json;
    }
}
