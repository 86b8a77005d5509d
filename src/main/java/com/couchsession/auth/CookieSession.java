package com.couchsession.auth;

import com.couchsession.error.AuthenticationException;
import com.couchsession.http.RequestDispatcher;
import com.couchsession.http.RequestOptions;
import com.couchsession.http.ResponseErrors;
import com.couchsession.http.Urls;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieStore;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Username/password session backed by the server's {@code _session} cookie.
 *
 * <p>With auto renewal on, a 401, or a 403 whose error is {@code credentials_expired}, causes one
 * login and one reissue of the same request. The reissued response is returned whatever its status.
 */
public class CookieSession implements AuthSession {

    private static final Logger log = LoggerFactory.getLogger(CookieSession.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RequestDispatcher dispatcher;
    private final URI serverUrl;
    private final URI sessionUrl;
    private final String username;
    private final String password;
    private final boolean autoRenew;
    private final CookieRenewal renewal = new CookieRenewal(this);

    public CookieSession(String username, String password, URI serverUrl, Duration timeout, boolean autoRenew) {
        this(username, password, serverUrl, new RequestDispatcher(timeout), autoRenew);
    }

    public CookieSession(String username, String password, URI serverUrl, RequestDispatcher dispatcher, boolean autoRenew) {
        this.username = username;
        this.password = password;
        this.serverUrl = serverUrl;
        this.sessionUrl = Urls.join(serverUrl, "_session");
        this.dispatcher = dispatcher;
        this.autoRenew = autoRenew;
    }

    @Override
    public void login() throws IOException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("name", username);
        form.put("password", password);
        HttpResponse<String> resp = dispatcher.send("POST", sessionUrl, RequestOptions.builder().form(form).build());
        if (!ResponseErrors.isSuccess(resp)) {
            log.warn("Cookie login for {} failed: {}", username, ResponseErrors.describe(resp));
            throw new AuthenticationException("Cookie login failed: " + ResponseErrors.describe(resp), resp.statusCode());
        }
        log.info("Cookie session established for {}", username);
    }

    @Override
    public void logout() throws IOException, InterruptedException {
        HttpResponse<String> resp = dispatcher.send("DELETE", sessionUrl, RequestOptions.none());
        if (!ResponseErrors.isSuccess(resp)) {
            throw new AuthenticationException("Cookie logout failed: " + ResponseErrors.describe(resp), resp.statusCode());
        }
        log.info("Cookie session closed for {}", username);
    }

    @Override
    public JsonNode info() throws IOException, InterruptedException {
        HttpResponse<String> resp = request("GET", sessionUrl, RequestOptions.none());
        if (!ResponseErrors.isSuccess(resp)) {
            throw new AuthenticationException("Session info failed: " + ResponseErrors.describe(resp), resp.statusCode());
        }
        return MAPPER.readTree(resp.body());
    }

    @Override
    public HttpResponse<String> request(String method, URI url, RequestOptions options)
            throws IOException, InterruptedException {
        return dispatcher.send(method, url, options, renewal, autoRenew);
    }

    @Override
    public URI serverUrl() {
        return serverUrl;
    }

    public String username() {
        return username;
    }

    public URI sessionUrl() {
        return sessionUrl;
    }

    @Override
    public CookieStore cookieStore() {
        return dispatcher.cookieStore();
    }

    @Override
    public boolean isAutoRenew() {
        return autoRenew;
    }
}
