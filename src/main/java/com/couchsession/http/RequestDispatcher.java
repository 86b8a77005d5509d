package com.couchsession.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieHandler;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.CookieStore;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;

/**
 * Issues every request made on behalf of a session.
 *
 * <p>Injects the session timeout and user agent, encodes query parameters and bodies, and
 * runs the renew-then-reissue cycle for sessions that carry a {@link RenewalStrategy}.
 * Credentials live in the {@link CookieManager} attached to the {@link HttpClient}.
 */
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);
    private static final String LIBRARY_VERSION = "1.0.0";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public static final String USER_AGENT = String.join("/",
            "couch-session",
            LIBRARY_VERSION,
            "Java",
            System.getProperty("java.version", "unknown"),
            System.getProperty("os.name", "unknown"),
            System.getProperty("os.arch", "unknown"));

    private final HttpClient http;
    private final CookieManager cookies;
    private final Duration timeout;

    /**
     * Builds a dispatcher with its own HTTP client and in-memory cookie store.
     *
     * @param timeout applied to every request, or null for none
     */
    public RequestDispatcher(Duration timeout) {
        this(newHttpClient(), timeout);
    }

    public RequestDispatcher(HttpClient http, Duration timeout) {
        this.http = http;
        this.cookies = http.cookieHandler()
                .filter(CookieManager.class::isInstance)
                .map(CookieManager.class::cast)
                .orElseThrow(() -> new IllegalArgumentException("HttpClient must be built with a CookieManager"));
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    public static HttpClient newHttpClient() {
        CookieHandler handler = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        return HttpClient.newBuilder()
                .cookieHandler(handler)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    public CookieStore cookieStore() {
        return cookies.getCookieStore();
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Sends a single request. Never retries; transport failures propagate unchanged.
     */
    public HttpResponse<String> send(String method, URI url, RequestOptions options)
            throws IOException, InterruptedException {
        RequestOptions opts = options == null ? RequestOptions.none() : options;
        URI target = Urls.withQuery(url, opts.query());

        HttpRequest.Builder builder = HttpRequest.newBuilder(target);
        if (!opts.hasHeader("User-Agent")) {
            builder.header("User-Agent", USER_AGENT);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }
        opts.headers().forEach((name, value) -> {
            // basic credentials replace a caller-supplied Authorization header
            if (!(opts.hasBasicAuth() && "Authorization".equalsIgnoreCase(name))) {
                builder.header(name, value);
            }
        });
        if (opts.hasBasicAuth()) {
            String pair = opts.basicUser() + ":" + opts.basicPassword();
            builder.header("Authorization", "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
        }

        HttpRequest.BodyPublisher publisher;
        if (opts.form() != null) {
            if (!opts.hasHeader("Content-Type")) {
                builder.header("Content-Type", "application/x-www-form-urlencoded");
            }
            publisher = HttpRequest.BodyPublishers.ofString(Urls.encodeParams(opts.form()), StandardCharsets.UTF_8);
        } else if (opts.body() != null) {
            publisher = HttpRequest.BodyPublishers.ofString(opts.body(), StandardCharsets.UTF_8);
        } else {
            publisher = HttpRequest.BodyPublishers.noBody();
        }
        String verb = method.toUpperCase(Locale.ROOT);
        builder.method(verb, publisher);

        log.debug("{} {}", verb, target);
        HttpResponse<String> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        log.debug("{} {} -> {}", verb, target, response.statusCode());
        return response;
    }

    /**
     * Sends a request on behalf of an authenticating session. With auto renewal on, credentials
     * may be renewed before sending, and an expired response triggers exactly one renewal and
     * one reissue whose response is returned as is.
     */
    public HttpResponse<String> send(String method, URI url, RequestOptions options,
                                     RenewalStrategy renewal, boolean autoRenew)
            throws IOException, InterruptedException {
        renewal.beforeRequest();
        if (autoRenew && renewal.renewBeforeRequest()) {
            log.debug("No live session credentials, logging in before {} {}", method, url);
            renewal.renew();
        }

        HttpResponse<String> response = send(method, url, options);
        if (!autoRenew || !renewal.isExpired(response)) {
            return response;
        }

        log.warn("Session credentials rejected (HTTP {}), renewing and retrying {} {}", response.statusCode(), method, url);
        renewal.renew();
        return send(method, url, options);
    }
}
