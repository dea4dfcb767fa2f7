package com.qqsuccubus.longpoll.server.poll;

import com.qqsuccubus.longpoll.core.model.Event;
import lombok.Value;

import java.util.List;

@Value
public class PollResult {
    String queueId;
    List<Event> events;
    PollOutcome outcome;
}
