package com.couchsession.auth;

import com.couchsession.Config;
import com.couchsession.error.AuthenticationException;
import com.couchsession.error.AuthenticationExchangeException;
import com.couchsession.error.InvalidTokenResponseException;
import com.couchsession.error.TokenServiceException;
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
 * Session authenticated with an IBM Cloud IAM API key.
 *
 * <p>Login trades the API key for an access token at the IAM token service, then trades the
 * token for an {@code IAMSession} cookie at {@code _iam_session}.
 */
public class IamSession implements AuthSession {

    private static final Logger log = LoggerFactory.getLogger(IamSession.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String GRANT_TYPE = "urn:ibm:params:oauth:grant-type:apikey";
    // fixed client credentials the token service expects for user API keys
    private static final String TOKEN_CLIENT_ID = "bx";
    private static final String TOKEN_CLIENT_SECRET = "bx";
    private static final String TOKEN_SERVICE_UNREACHABLE = "Failed to contact IAM token service";
    private static final String EXCHANGE_FAILED = "Failed to exchange IAM token with Cloudant";

    private final RequestDispatcher dispatcher;
    private final URI serverUrl;
    private final URI sessionUrl;
    private final URI tokenUrl;
    private final String apiKey;
    private final boolean autoRenew;
    private final IamRenewal renewal;

    public IamSession(String apiKey, URI serverUrl, Duration timeout, boolean autoRenew) {
        this(apiKey, serverUrl, new RequestDispatcher(timeout), autoRenew, null);
    }

    /**
     * @param tokenUrl token service endpoint; null falls back to {@code IAM_TOKEN_URL} or the public IAM endpoint
     */
    public IamSession(String apiKey, URI serverUrl, RequestDispatcher dispatcher, boolean autoRenew, URI tokenUrl) {
        this.apiKey = apiKey;
        this.serverUrl = serverUrl;
        this.sessionUrl = Urls.join(serverUrl, "_iam_session");
        this.tokenUrl = tokenUrl != null ? tokenUrl : URI.create(Config.getIamTokenUrl());
        this.dispatcher = dispatcher;
        this.autoRenew = autoRenew;
        this.renewal = new IamRenewal(this, dispatcher.cookieStore());
    }

    @Override
    public void login() throws IOException, InterruptedException {
        String accessToken = getAccessToken();
        HttpResponse<String> resp;
        try {
            String body = MAPPER.writeValueAsString(Map.of("access_token", accessToken));
            resp = dispatcher.send("POST", sessionUrl, RequestOptions.builder().jsonBody(body).build());
        } catch (IOException e) {
            log.warn("IAM token exchange request failed: {}", e.getMessage());
            throw new AuthenticationExchangeException(EXCHANGE_FAILED, e);
        }
        if (!ResponseErrors.isSuccess(resp)) {
            log.warn("IAM token exchange rejected: {}", ResponseErrors.describe(resp));
            throw new AuthenticationExchangeException(EXCHANGE_FAILED);
        }
        log.info("IAM session established at {}", serverUrl);
    }

    /**
     * Drops every cookie held for this session. The server is not contacted.
     */
    @Override
    public void logout() {
        dispatcher.cookieStore().removeAll();
    }

    @Override
    public JsonNode info() throws IOException, InterruptedException {
        HttpResponse<String> resp = request("GET", sessionUrl, RequestOptions.none());
        if (!ResponseErrors.isSuccess(resp)) {
            throw new AuthenticationException("IAM session info failed: " + ResponseErrors.describe(resp), resp.statusCode());
        }
        return MAPPER.readTree(resp.body());
    }

    @Override
    public HttpResponse<String> request(String method, URI url, RequestOptions options)
            throws IOException, InterruptedException {
        return dispatcher.send(method, url, options, renewal, autoRenew);
    }

    String getAccessToken() throws InterruptedException {
        String err = TOKEN_SERVICE_UNREACHABLE;
        try {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", GRANT_TYPE);
            form.put("response_type", "cloud_iam");
            form.put("apikey", apiKey);
            HttpResponse<String> resp = dispatcher.send("POST", tokenUrl, RequestOptions.builder()
                    .basicAuth(TOKEN_CLIENT_ID, TOKEN_CLIENT_SECRET)
                    .header("Accept", "application/json")
                    .form(form)
                    .build());

            JsonNode root = readJson(resp.body());
            if (root != null && root.hasNonNull("errorMessage")) {
                err = root.get("errorMessage").asText();
            }
            if (!ResponseErrors.isSuccess(resp)) {
                log.warn("IAM token request rejected (HTTP {}): {}", resp.statusCode(), err);
                throw new TokenServiceException(err);
            }
            if (root == null || !root.hasNonNull("access_token")) {
                throw new InvalidTokenResponseException("Invalid response from IAM token service");
            }
            return root.get("access_token").asText();
        } catch (IOException e) {
            log.warn("IAM token service unreachable at {}: {}", tokenUrl, e.getMessage());
            throw new TokenServiceException(err, e);
        }
    }

    private static JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            log.debug("IAM token service returned a non-JSON body");
            return null;
        }
    }

    @Override
    public URI serverUrl() {
        return serverUrl;
    }

    public URI sessionUrl() {
        return sessionUrl;
    }

    public URI tokenUrl() {
        return tokenUrl;
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
