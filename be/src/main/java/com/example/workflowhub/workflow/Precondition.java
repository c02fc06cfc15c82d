package com.example.workflowhub.workflow;

import com.example.workflowhub.security.Actor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A structured guard on a transition, evaluated against the entity payload and the acting identity.
 * <p>
 * {@code field} names a payload key, or {@code actor.id} for the acting identity. Values are
 * compared by their string form so JSON numbers and booleans match their configured literal.
 * </p>
 */
public record Precondition(String field, PreconditionOperator operator, String value, List<String> values) {

    public static final String ACTOR_ID_FIELD = "actor.id";

    public Precondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        values = values != null ? List.copyOf(values) : List.of();
    }

    public boolean test(Map<String, Object> payload, Actor actor) {
        Object actual = ACTOR_ID_FIELD.equals(field)
                ? (actor != null ? actor.id() : null)
                : (payload != null ? payload.get(field) : null);
        boolean present = actual != null && !(actual instanceof String s && s.isBlank());
        return switch (operator) {
            case PRESENT -> present;
            case ABSENT -> !present;
            case EQUALS -> present && String.valueOf(actual).equals(value);
            case NOT_EQUALS -> !present || !String.valueOf(actual).equals(value);
            case IN -> present && values.contains(String.valueOf(actual));
        };
    }

    /** Machine-readable failure detail, e.g. {@code precondition_failed:artist_name:present}. */
    public String failureDetail() {
        return "precondition_failed:" + field + ":" + operator.key();
    }
}
