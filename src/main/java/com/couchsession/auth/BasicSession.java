package com.couchsession.auth;

import com.couchsession.error.AuthenticationException;
import com.couchsession.http.RenewalStrategy;
import com.couchsession.http.RequestDispatcher;
import com.couchsession.http.RequestOptions;
import com.couchsession.http.ResponseErrors;
import com.couchsession.http.Urls;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.CookieStore;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Session without a login step. Optional basic credentials go out with every request.
 */
public class BasicSession implements AuthSession {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RequestDispatcher dispatcher;
    private final URI serverUrl;
    private final String username;
    private final String password;

    public BasicSession(URI serverUrl, Duration timeout) {
        this(serverUrl, null, null, new RequestDispatcher(timeout));
    }

    public BasicSession(URI serverUrl, String username, String password, RequestDispatcher dispatcher) {
        this.serverUrl = serverUrl;
        this.username = username;
        this.password = password;
        this.dispatcher = dispatcher;
    }

    @Override
    public HttpResponse<String> request(String method, URI url, RequestOptions options)
            throws IOException, InterruptedException {
        RequestOptions opts = options == null ? RequestOptions.none() : options;
        return dispatcher.send(method, url, opts.withDefaultBasicAuth(username, password), RenewalStrategy.NONE, false);
    }

    @Override
    public void login() {
        // credentials travel with each request
    }

    @Override
    public void logout() {
    }

    @Override
    public JsonNode info() throws IOException, InterruptedException {
        HttpResponse<String> resp = request("GET", Urls.join(serverUrl, "_session"), RequestOptions.none());
        if (!ResponseErrors.isSuccess(resp)) {
            throw new AuthenticationException("Session info failed: " + ResponseErrors.describe(resp), resp.statusCode());
        }
        return MAPPER.readTree(resp.body());
    }

    @Override
    public URI serverUrl() {
        return serverUrl;
    }

    @Override
    public CookieStore cookieStore() {
        return dispatcher.cookieStore();
    }

    @Override
    public boolean isAutoRenew() {
        return false;
    }
}
