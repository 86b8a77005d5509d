package com.couchsession.query;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.couchsession.query.ValueKind.BOOLEAN;
import static com.couchsession.query.ValueKind.INTEGER;
import static com.couchsession.query.ValueKind.MAPPING;
import static com.couchsession.query.ValueKind.NULL;
import static com.couchsession.query.ValueKind.SEQUENCE;
import static com.couchsession.query.ValueKind.STRING;

/**
 * Recognised option names per endpoint family and the value kinds each accepts.
 */
public final class OptionTypes {

    /** View and {@code _all_docs} result options. */
    public static final Map<String, Set<ValueKind>> RESULT_ARG_TYPES;

    /** Cloudant Query ({@code _find}) body fields. */
    public static final Map<String, Set<ValueKind>> QUERY_ARG_TYPES;

    /** Text index definition fields. */
    public static final Map<String, Set<ValueKind>> TEXT_INDEX_ARGS;

    /** Search index query options. */
    public static final Map<String, Set<ValueKind>> SEARCH_INDEX_ARGS;

    static final Map<String, Set<ValueKind>> COUCH_DB_UPDATES_ARG_TYPES;
    static final Map<String, Set<ValueKind>> DB_UPDATES_ARG_TYPES;
    static final Map<String, Set<ValueKind>> CHANGES_ARG_TYPES;

    static {
        Map<String, Set<ValueKind>> result = new LinkedHashMap<>();
        result.put("descending", kinds(BOOLEAN));
        result.put("endkey", kinds(INTEGER, STRING, SEQUENCE));
        result.put("endkey_docid", kinds(STRING));
        result.put("group", kinds(BOOLEAN));
        result.put("group_level", kinds(INTEGER, NULL));
        result.put("include_docs", kinds(BOOLEAN));
        result.put("inclusive_end", kinds(BOOLEAN));
        result.put("key", kinds(INTEGER, STRING, SEQUENCE));
        result.put("keys", kinds(SEQUENCE));
        result.put("limit", kinds(INTEGER, NULL));
        result.put("reduce", kinds(BOOLEAN));
        result.put("skip", kinds(INTEGER, NULL));
        result.put("stale", kinds(STRING));
        result.put("startkey", kinds(INTEGER, STRING, SEQUENCE));
        result.put("startkey_docid", kinds(STRING));
        RESULT_ARG_TYPES = Collections.unmodifiableMap(result);

        Map<String, Set<ValueKind>> couchUpdates = new LinkedHashMap<>();
        couchUpdates.put("feed", kinds(STRING));
        couchUpdates.put("heartbeat", kinds(BOOLEAN));
        couchUpdates.put("timeout", kinds(INTEGER, NULL));
        COUCH_DB_UPDATES_ARG_TYPES = Collections.unmodifiableMap(couchUpdates);

        Map<String, Set<ValueKind>> dbUpdates = new LinkedHashMap<>();
        dbUpdates.put("descending", kinds(BOOLEAN));
        dbUpdates.put("limit", kinds(INTEGER, NULL));
        dbUpdates.put("since", kinds(INTEGER, STRING));
        dbUpdates.putAll(couchUpdates);
        // Cloudant takes a heartbeat interval in milliseconds rather than a flag.
        dbUpdates.put("heartbeat", kinds(INTEGER, NULL));
        DB_UPDATES_ARG_TYPES = Collections.unmodifiableMap(dbUpdates);

        Map<String, Set<ValueKind>> changes = new LinkedHashMap<>();
        changes.put("conflicts", kinds(BOOLEAN));
        changes.put("doc_ids", kinds(SEQUENCE));
        changes.put("filter", kinds(STRING));
        changes.put("include_docs", kinds(BOOLEAN));
        changes.put("style", kinds(STRING));
        changes.putAll(dbUpdates);
        CHANGES_ARG_TYPES = Collections.unmodifiableMap(changes);

        Map<String, Set<ValueKind>> query = new LinkedHashMap<>();
        query.put("selector", kinds(MAPPING));
        query.put("limit", kinds(INTEGER, NULL));
        query.put("skip", kinds(INTEGER, NULL));
        query.put("sort", kinds(SEQUENCE));
        query.put("fields", kinds(SEQUENCE));
        query.put("r", kinds(INTEGER, NULL));
        query.put("bookmark", kinds(STRING));
        query.put("use_index", kinds(STRING));
        QUERY_ARG_TYPES = Collections.unmodifiableMap(query);

        Map<String, Set<ValueKind>> textIndex = new LinkedHashMap<>();
        textIndex.put("fields", kinds(SEQUENCE));
        textIndex.put("default_field", kinds(MAPPING));
        textIndex.put("selector", kinds(MAPPING));
        TEXT_INDEX_ARGS = Collections.unmodifiableMap(textIndex);

        Map<String, Set<ValueKind>> search = new LinkedHashMap<>();
        search.put("bookmark", kinds(STRING));
        search.put("counts", kinds(SEQUENCE));
        search.put("drilldown", kinds(SEQUENCE));
        search.put("group_field", kinds(STRING));
        search.put("group_limit", kinds(INTEGER, NULL));
        search.put("group_sort", kinds(STRING, SEQUENCE));
        search.put("include_docs", kinds(BOOLEAN));
        search.put("limit", kinds(INTEGER, NULL));
        search.put("query", kinds(STRING, INTEGER));
        search.put("q", kinds(STRING, INTEGER));
        search.put("ranges", kinds(MAPPING));
        search.put("sort", kinds(STRING, SEQUENCE));
        search.put("stale", kinds(STRING));
        search.put("highlight_fields", kinds(SEQUENCE));
        search.put("highlight_pre_tag", kinds(STRING));
        search.put("highlight_post_tag", kinds(STRING));
        search.put("highlight_number", kinds(INTEGER, NULL));
        search.put("highlight_size", kinds(INTEGER, NULL));
        search.put("include_fields", kinds(SEQUENCE));
        SEARCH_INDEX_ARGS = Collections.unmodifiableMap(search);
    }

    private OptionTypes() {}

    public static Map<String, Set<ValueKind>> feedArgTypes(FeedKind kind) {
        switch (kind) {
            case CLOUDANT_UPDATES:
                return DB_UPDATES_ARG_TYPES;
            case COUCHDB_UPDATES:
                return COUCH_DB_UPDATES_ARG_TYPES;
            default:
                return CHANGES_ARG_TYPES;
        }
    }

    public static Map<String, Set<ValueKind>> feedArgTypes(String feedName) {
        return feedArgTypes(FeedKind.fromName(feedName));
    }

    private static Set<ValueKind> kinds(ValueKind first, ValueKind... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
