package com.couchsession.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call request details. The timeout is deliberately absent: every request issued through
 * a session uses the session's timeout.
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final Map<String, String> headers;
    private final Map<String, Object> query;
    private final Map<String, String> form;
    private final String body;
    private final String basicUser;
    private final String basicPassword;

    private RequestOptions(Builder builder) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
        this.form = builder.form == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.form));
        this.body = builder.body;
        this.basicUser = builder.basicUser;
        this.basicPassword = builder.basicPassword;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, Object> query() {
        return query;
    }

    public Map<String, String> form() {
        return form;
    }

    public String body() {
        return body;
    }

    public boolean hasBasicAuth() {
        return basicUser != null;
    }

    public String basicUser() {
        return basicUser;
    }

    public String basicPassword() {
        return basicPassword;
    }

    public boolean hasHeader(String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of these options with basic credentials added, unless the caller already set some.
     */
    public RequestOptions withDefaultBasicAuth(String user, String password) {
        if (user == null || hasBasicAuth()) {
            return this;
        }
        Builder copy = new Builder();
        copy.headers.putAll(headers);
        copy.query.putAll(query);
        copy.form = form == null ? null : new LinkedHashMap<>(form);
        copy.body = body;
        return copy.basicAuth(user, password).build();
    }

    public static final class Builder {
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, Object> query = new LinkedHashMap<>();
        private Map<String, String> form;
        private String body;
        private String basicUser;
        private String basicPassword;

        private Builder() {}

        /**
         * Sets a header, replacing any earlier value whose name differs only in case.
         */
        public Builder header(String name, String value) {
            headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        public Builder query(String name, Object value) {
            query.put(name, value);
            return this;
        }

        public Builder query(Map<String, ?> values) {
            if (values != null) {
                query.putAll(values);
            }
            return this;
        }

        public Builder form(Map<String, String> values) {
            this.form = values == null ? null : new LinkedHashMap<>(values);
            this.body = null;
            return this;
        }

        public Builder body(String value) {
            this.body = value;
            this.form = null;
            return this;
        }

        public Builder jsonBody(String json) {
            header("Content-Type", "application/json");
            return body(json);
        }

        public Builder basicAuth(String user, String password) {
            this.basicUser = user;
            this.basicPassword = password == null ? "" : password;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
