package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.Event;

/**
 * Folds one event of a given type into snapshot state.
 */
@FunctionalInterface
interface EventApplier {

    void apply(ObjectNode state, Event event);
}
