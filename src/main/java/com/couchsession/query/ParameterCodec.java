package com.couchsession.query;

import com.couchsession.error.InvalidKeyListItemException;
import com.couchsession.error.InvalidOptionTypeException;
import com.couchsession.error.InvalidStaleValueException;
import com.couchsession.error.OptionConversionException;
import com.couchsession.error.UnknownOptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns Java-side query options into the values the server expects on the query string,
 * e.g. {@code include_docs=true} becomes {@code "true"} and {@code key="foo"} becomes {@code "\"foo\""}.
 *
 * <p>Most typed options are JSON encoded. Document ids and the stale mode go out as literal
 * strings, and {@code keys} is left untouched because it travels in a POST body.
 */
public final class ParameterCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> PASS_THROUGH = Set.of("keys", "endkey_docid", "startkey_docid", "stale");
    private static final Set<String> STALE_VALUES = Set.of("ok", "update_after");

    private ParameterCodec() {}

    /**
     * Validates and converts every entry. Iteration order of the input is kept.
     *
     * @throws com.couchsession.error.CouchArgumentException on the first invalid entry
     */
    public static Map<String, Object> translate(Map<String, ?> options) {
        Map<String, Object> translation = new LinkedHashMap<>();
        if (options == null) {
            return translation;
        }
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            validate(entry.getKey(), entry.getValue());
            translation.put(entry.getKey(), convert(entry.getKey(), entry.getValue()));
        }
        return translation;
    }

    public static void validate(String key, Object value) {
        Set<ValueKind> declared = OptionTypes.RESULT_ARG_TYPES.get(key);
        if (declared == null) {
            throw new UnknownOptionException(key);
        }
        checkKind(key, value, declared);

        if ("keys".equals(key)) {
            Set<ValueKind> keyKinds = OptionTypes.RESULT_ARG_TYPES.get("key");
            for (Object item : (List<?>) value) {
                ValueKind kind = ValueKind.of(item);
                if (kind == ValueKind.BOOLEAN || !keyKinds.contains(kind)) {
                    throw new InvalidKeyListItemException(keyKinds);
                }
            }
        }
        if ("stale".equals(key) && !STALE_VALUES.contains(value.toString())) {
            throw new InvalidStaleValueException(value);
        }
    }

    public static Object convert(String key, Object value) {
        if (PASS_THROUGH.contains(key)) {
            return value;
        }
        ValueKind kind = ValueKind.of(value);
        try {
            switch (kind) {
                case NULL:
                    return null;
                case STRING:
                    return MAPPER.writeValueAsString(value.toString());
                case SEQUENCE:
                    return MAPPER.writeValueAsString(value);
                case BOOLEAN:
                    return ((Boolean) value) ? "true" : "false";
                case INTEGER:
                    return value;
                default:
                    throw new OptionConversionException(key,
                            new IllegalArgumentException("No conversion for " + kind + " value of type " + value.getClass().getName()));
            }
        } catch (JsonProcessingException e) {
            throw new OptionConversionException(key, e);
        }
    }

    /**
     * Checks names and value kinds against an arbitrary option table without converting anything.
     * Used for request bodies such as {@code _find} and search queries.
     */
    public static void validateOptions(Map<String, Set<ValueKind>> table, Map<String, ?> options) {
        if (options == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            Set<ValueKind> declared = table.get(entry.getKey());
            if (declared == null) {
                throw new UnknownOptionException(entry.getKey());
            }
            checkKind(entry.getKey(), entry.getValue(), declared);
        }
    }

    public static void validateFeedOptions(FeedKind feed, Map<String, ?> options) {
        validateOptions(OptionTypes.feedArgTypes(feed), options);
    }

    public static Map<String, Set<ValueKind>> feedArgTypes(FeedKind feed) {
        return OptionTypes.feedArgTypes(feed);
    }

    public static Map<String, Set<ValueKind>> feedArgTypes(String feedName) {
        return OptionTypes.feedArgTypes(feedName);
    }

    private static void checkKind(String key, Object value, Set<ValueKind> declared) {
        ValueKind kind = ValueKind.of(value);
        if (!declared.contains(kind) || (kind == ValueKind.BOOLEAN && declared.contains(ValueKind.INTEGER))) {
            throw new InvalidOptionTypeException(key, declared);
        }
    }
}
