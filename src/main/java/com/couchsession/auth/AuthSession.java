package com.couchsession.auth;

import com.couchsession.http.RequestOptions;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.CookieStore;
import java.net.URI;
import java.net.http.HttpResponse;

/**
 * An HTTP session against one database server. Every request is sent with the session's
 * timeout; authenticating variants renew their credentials at most once per request.
 *
 * <p>Not safe for concurrent renewal. Two callers racing a renewal each retry their own
 * request once at most.
 */
public interface AuthSession {

    HttpResponse<String> request(String method, URI url, RequestOptions options)
            throws IOException, InterruptedException;

    default HttpResponse<String> get(URI url, RequestOptions options) throws IOException, InterruptedException {
        return request("GET", url, options);
    }

    default HttpResponse<String> post(URI url, RequestOptions options) throws IOException, InterruptedException {
        return request("POST", url, options);
    }

    default HttpResponse<String> put(URI url, RequestOptions options) throws IOException, InterruptedException {
        return request("PUT", url, options);
    }

    default HttpResponse<String> delete(URI url, RequestOptions options) throws IOException, InterruptedException {
        return request("DELETE", url, options);
    }

    void login() throws IOException, InterruptedException;

    void logout() throws IOException, InterruptedException;

    /**
     * Session details as reported by the server.
     *
     * @throws com.couchsession.error.AuthenticationException when the server refuses
     */
    JsonNode info() throws IOException, InterruptedException;

    URI serverUrl();

    CookieStore cookieStore();

    boolean isAutoRenew();
}
