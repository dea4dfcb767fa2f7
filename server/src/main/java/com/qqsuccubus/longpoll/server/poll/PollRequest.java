package com.qqsuccubus.longpoll.server.poll;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class PollRequest {
    String queueId;
    long principalId;

    // -1 reads the queue from the beginning.
    @Builder.Default
    long lastEventId = -1;

    boolean dontBlock;

    // Null uses the configured poll timeout.
    Duration timeout;
}
