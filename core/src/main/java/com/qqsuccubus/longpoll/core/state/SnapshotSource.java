package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;

import java.util.Set;

/**
 * Domain side of the snapshot: reads the current state a principal can see.
 */
public interface SnapshotSource {

    /**
     * Fetches the sections relevant to {@code wanted} (see {@link SnapshotSection#wantedBy}).
     *
     * @param principalId principal whose view is fetched
     * @param wanted      known event types the client registered for; may be empty
     * @param narrow      the client's narrow
     * @return a fresh object the caller may mutate
     */
    ObjectNode fetchSections(long principalId, Set<EventType> wanted, Narrow narrow);
}
