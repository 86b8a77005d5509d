package com.couchsession.query;

/**
 * The three flavours of change feed, each accepting a different option table.
 */
public enum FeedKind {
    /** CouchDB {@code _db_updates}. */
    COUCHDB_UPDATES("CouchDB"),
    /** Cloudant {@code _db_updates}. */
    CLOUDANT_UPDATES("Cloudant"),
    /** Per-database {@code _changes}. */
    CHANGES("Changes");

    private final String feedName;

    FeedKind(String feedName) {
        this.feedName = feedName;
    }

    public String feedName() {
        return feedName;
    }

    /**
     * Anything that is not exactly "CouchDB" or "Cloudant" is a database changes feed.
     */
    public static FeedKind fromName(String name) {
        if (COUCHDB_UPDATES.feedName.equals(name)) {
            return COUCHDB_UPDATES;
        }
        if (CLOUDANT_UPDATES.feedName.equals(name)) {
            return CLOUDANT_UPDATES;
        }
        return CHANGES;
    }
}
