package com.qqsuccubus.longpoll.server.realm;

import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small realm with a few users, a bot and some streams.
 */
public final class DemoRealm {
    private static final Logger log = LoggerFactory.getLogger(DemoRealm.class);

    public static final String DOMAIN = "zulip.com";

    @Value
    public static class Ids {
        long realmId;
        long hamlet;
        long othello;
        long iago;
        long cordelia;
        long welcomeBot;
    }

    private DemoRealm() {
    }

    public static Ids seed(RealmActions actions) {
        RealmStore store = actions.getStore();
        Realm realm = store.createRealm(DOMAIN, "Zulip Dev");
        long realmId = realm.getId();

        long hamlet = actions.createUser(realmId, "hamlet@zulip.com", "King Hamlet").getId();
        long othello = actions.createUser(realmId, "othello@zulip.com", "Othello, the Moor of Venice").getId();
        long iago = actions.createUser(realmId, "iago@zulip.com", "Iago").getId();
        long cordelia = actions.createUser(realmId, "cordelia@zulip.com", "Cordelia Lear").getId();
        actions.changeIsAdmin(iago, true);
        long welcomeBot = actions.createBot(hamlet, "welcome-bot@zulip.com", "Welcome Bot").getId();

        actions.createStream(realmId, "Verona", "A city in Italy", false);
        actions.createStream(realmId, "Denmark", "A Scandinavian country", false);
        actions.createStream(realmId, "Scotland", "Located in the United Kingdom", false);
        actions.createStream(realmId, "Rome", "Yet another Italian city", false);

        for (String stream : new String[]{"Verona", "Denmark", "Scotland"}) {
            actions.subscribe(hamlet, stream);
        }
        actions.subscribe(othello, "Verona");
        actions.subscribe(othello, "Denmark");
        actions.subscribe(iago, "Verona");
        actions.subscribe(cordelia, "Denmark");

        log.info("Seeded demo realm {} with {} users", DOMAIN, store.activeUserIds(realmId).size());
        return new Ids(realmId, hamlet, othello, iago, cordelia, welcomeBot);
    }
}
