package com.couchsession.auth;

import com.couchsession.Config;
import com.couchsession.error.AuthenticationException;
import com.couchsession.error.AuthenticationExchangeException;
import com.couchsession.error.InvalidTokenResponseException;
import com.couchsession.error.TokenServiceException;
import com.couchsession.http.RequestDispatcher;
import com.couchsession.http.RequestOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.HttpCookie;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IamSessionTest {

    private HttpServer server;
    private URI baseUrl;
    private URI tokenUrl;

    private final AtomicInteger tokenRequests = new AtomicInteger();
    private final AtomicInteger exchanges = new AtomicInteger();
    private final AtomicInteger dbHits = new AtomicInteger();
    private final AtomicBoolean rejectExchange = new AtomicBoolean();
    private final AtomicReference<String> lastTokenAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastTokenForm = new AtomicReference<>();
    private final AtomicReference<String> lastExchangeBody = new AtomicReference<>();
    private final AtomicReference<String> lastDbCookie = new AtomicReference<>();
    private final Deque<Integer> dbStatuses = new ConcurrentLinkedDeque<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/identity/token", ex -> {
            lastTokenAuthorization.set(ex.getRequestHeaders().getFirst("Authorization"));
            String form = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            lastTokenForm.set(form);
            if (form.contains("apikey=bad-key")) {
                respond(ex, 400, "{\"errorCode\":\"BXNIM0415E\",\"errorMessage\":\"Provided API key could not be found\"}");
                return;
            }
            if (form.contains("apikey=garbled-key")) {
                respond(ex, 200, "{\"token_type\":\"Bearer\",\"expires_in\":3600}");
                return;
            }
            if (form.contains("apikey=broken-key")) {
                respond(ex, 503, "<html>maintenance</html>");
                return;
            }
            int n = tokenRequests.incrementAndGet();
            respond(ex, 200, "{\"access_token\":\"tok-" + n + "\",\"token_type\":\"Bearer\",\"expires_in\":3600}");
        });
        server.createContext("/_iam_session", ex -> {
            if ("POST".equals(ex.getRequestMethod())) {
                lastExchangeBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                if (rejectExchange.get()) {
                    respond(ex, 401, "{\"error\":\"unauthorized\",\"reason\":\"Invalid access token\"}");
                    return;
                }
                int n = exchanges.incrementAndGet();
                ex.getResponseHeaders().add("Set-Cookie", "IAMSession=sess-" + n + "; Path=/; HttpOnly");
                respond(ex, 200, "{\"ok\":true}");
                return;
            }
            String cookie = ex.getRequestHeaders().getFirst("Cookie");
            if (cookie != null && cookie.contains("IAMSession=sess-")) {
                respond(ex, 200, "{\"ok\":true,\"info\":{\"authenticated\":\"cookie\"},\"userCtx\":{\"name\":\"iam-user\"}}");
            } else {
                respond(ex, 401, "{\"error\":\"unauthorized\",\"reason\":\"You are not logged in.\"}");
            }
        });
        server.createContext("/animals", ex -> {
            dbHits.incrementAndGet();
            lastDbCookie.set(ex.getRequestHeaders().getFirst("Cookie"));
            Integer status = dbStatuses.pollFirst();
            respond(ex, status != null ? status : 200, "{\"db_name\":\"animals\"}");
        });
        server.start();
        baseUrl = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        tokenUrl = URI.create(baseUrl + "/identity/token");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private IamSession session(String apiKey, boolean autoRenew) {
        return new IamSession(apiKey, baseUrl, new RequestDispatcher(Duration.ofSeconds(5)), autoRenew, tokenUrl);
    }

    private URI db() {
        return URI.create(baseUrl + "/animals");
    }

    @Test
    void loginExchangesApiKeyThenToken() throws Exception {
        IamSession session = session("good-key", false);
        session.login();

        assertEquals("Basic Yng6Yng=", lastTokenAuthorization.get());
        assertEquals("grant_type=urn%3Aibm%3Aparams%3Aoauth%3Agrant-type%3Aapikey&response_type=cloud_iam&apikey=good-key",
                lastTokenForm.get());
        assertEquals("{\"access_token\":\"tok-1\"}", lastExchangeBody.get());
        assertTrue(session.cookieStore().getCookies().stream().anyMatch(c -> "IAMSession".equals(c.getName())));
    }

    @Test
    void logsInBeforeFirstRequestWhenNoSessionCookie() throws Exception {
        HttpResponse<String> resp = session("good-key", true).get(db(), RequestOptions.none());

        assertEquals(200, resp.statusCode());
        assertEquals(1, tokenRequests.get());
        assertEquals(1, exchanges.get());
        assertEquals(1, dbHits.get());
        assertTrue(lastDbCookie.get().contains("IAMSession=sess-1"));
    }

    @Test
    void liveSessionCookieSkipsLogin() throws Exception {
        IamSession session = session("good-key", true);
        session.login();
        session.get(db(), RequestOptions.none());
        session.get(db(), RequestOptions.none());

        assertEquals(1, tokenRequests.get());
        assertEquals(2, dbHits.get());
    }

    @Test
    void expiredSessionCookieIsDroppedAndRenewed() throws Exception {
        IamSession session = session("good-key", true);
        HttpCookie stale = new HttpCookie("IAMSession", "old");
        stale.setPath("/");
        stale.setMaxAge(1);
        session.cookieStore().add(baseUrl, stale);
        assertTrue(IamRenewal.hasLiveCookie(session.cookieStore(), "IAMSession"));

        Thread.sleep(2100);
        session.get(db(), RequestOptions.none());

        assertEquals(1, tokenRequests.get());
        assertFalse(lastDbCookie.get().contains("old"));
        assertTrue(lastDbCookie.get().contains("IAMSession=sess-1"));
    }

    @Test
    void unauthorizedRenewsAndReissuesOnce() throws Exception {
        IamSession session = session("good-key", true);
        session.login();
        dbStatuses.add(401);

        HttpResponse<String> resp = session.get(db(), RequestOptions.none());

        assertEquals(200, resp.statusCode());
        assertEquals(2, tokenRequests.get());
        assertEquals(2, dbHits.get());
        assertTrue(lastDbCookie.get().contains("IAMSession=sess-2"));
    }

    @Test
    void secondUnauthorizedIsReturnedToCaller() throws Exception {
        IamSession session = session("good-key", true);
        session.login();
        dbStatuses.add(401);
        dbStatuses.add(401);

        HttpResponse<String> resp = session.get(db(), RequestOptions.none());

        assertEquals(401, resp.statusCode());
        assertEquals(2, tokenRequests.get());
        assertEquals(2, dbHits.get());
    }

    @Test
    void forbiddenIsNotTreatedAsExpiry() throws Exception {
        IamSession session = session("good-key", true);
        session.login();
        dbStatuses.add(403);

        assertEquals(403, session.get(db(), RequestOptions.none()).statusCode());
        assertEquals(1, tokenRequests.get());
        assertEquals(1, dbHits.get());
    }

    @Test
    void withoutAutoRenewNothingIsRenewed() throws Exception {
        dbStatuses.add(401);
        HttpResponse<String> resp = session("good-key", false).get(db(), RequestOptions.none());

        assertEquals(401, resp.statusCode());
        assertEquals(0, tokenRequests.get());
        assertEquals(1, dbHits.get());
    }

    @Test
    void tokenServiceErrorMessageIsSurfaced() {
        TokenServiceException ex = assertThrows(TokenServiceException.class, () -> session("bad-key", true).login());
        assertEquals("Provided API key could not be found", ex.getMessage());
        assertEquals(0, exchanges.get());
    }

    @Test
    void tokenServiceFailureWithoutDetailsUsesGenericMessage() {
        TokenServiceException ex = assertThrows(TokenServiceException.class, () -> session("broken-key", true).login());
        assertEquals("Failed to contact IAM token service", ex.getMessage());
    }

    @Test
    void missingAccessTokenIsAnInvalidResponse() {
        assertThrows(InvalidTokenResponseException.class, () -> session("garbled-key", true).login());
        assertEquals(0, exchanges.get());
    }

    @Test
    void unreachableTokenServiceIsWrapped() {
        IamSession session = new IamSession("good-key", baseUrl, new RequestDispatcher(Duration.ofSeconds(5)), true,
                URI.create("http://127.0.0.1:1/identity/token"));
        TokenServiceException ex = assertThrows(TokenServiceException.class, session::login);
        assertEquals("Failed to contact IAM token service", ex.getMessage());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void rejectedTokenExchangeFails() {
        rejectExchange.set(true);
        AuthenticationExchangeException ex = assertThrows(AuthenticationExchangeException.class,
                () -> session("good-key", true).login());
        assertEquals("Failed to exchange IAM token with Cloudant", ex.getMessage());
    }

    @Test
    void rejectedExchangeDuringRequestPropagates() {
        rejectExchange.set(true);
        assertThrows(AuthenticationExchangeException.class, () -> session("good-key", true).get(db(), RequestOptions.none()));
        assertEquals(0, dbHits.get());
    }

    @Test
    void logoutClearsCookiesWithoutContactingServer() throws Exception {
        IamSession session = session("good-key", false);
        session.login();
        assertFalse(session.cookieStore().getCookies().isEmpty());

        session.logout();

        assertTrue(session.cookieStore().getCookies().isEmpty());
        assertEquals(1, exchanges.get());
    }

    @Test
    void infoReadsIamSession() throws Exception {
        IamSession session = session("good-key", false);
        session.login();
        JsonNode info = session.info();
        assertEquals("cookie", info.path("info").path("authenticated").asText());
    }

    @Test
    void infoWithoutSessionFails() {
        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> session("good-key", false).info());
        assertEquals(401, ex.getStatusCode());
    }

    @Test
    void tokenUrlFallsBackToConfiguration() {
        IamSession session = new IamSession("k", URI.create("https://acct.example.com"), Duration.ofSeconds(1), true);
        assertEquals(URI.create(Config.getIamTokenUrl()), session.tokenUrl());
        assertEquals(URI.create("https://acct.example.com/_iam_session"), session.sessionUrl());
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
