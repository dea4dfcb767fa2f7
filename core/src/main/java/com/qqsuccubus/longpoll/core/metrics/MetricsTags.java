package com.qqsuccubus.longpoll.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for event type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for poll outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for removal reason.
     */
    public static final String REASON = "reason";
}
