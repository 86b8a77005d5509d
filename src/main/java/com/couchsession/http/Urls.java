package com.couchsession.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

public final class Urls {

    private Urls() {}

    public static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /**
     * Appends one path segment to a server URL, tolerating slashes on either side.
     */
    public static URI join(URI base, String segment) {
        String root = base.toString();
        while (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        String tail = segment == null ? "" : segment;
        while (tail.startsWith("/")) {
            tail = tail.substring(1);
        }
        return URI.create(root + "/" + tail);
    }

    /**
     * Encodes query parameters; entries with a null value are left out.
     */
    public static String encodeParams(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner("&");
        if (params == null) {
            return "";
        }
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            joiner.add(urlEncode(entry.getKey()) + "=" + urlEncode(String.valueOf(entry.getValue())));
        }
        return joiner.toString();
    }

    public static URI withQuery(URI url, Map<String, ?> params) {
        String qs = encodeParams(params);
        if (qs.isEmpty()) {
            return url;
        }
        String separator = url.getRawQuery() == null ? "?" : "&";
        return URI.create(url + separator + qs);
    }
}
