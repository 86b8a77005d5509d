package com.couchsession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection settings. Sources in order of precedence: process environment, then
 * {@code ~/.couch-session/couch.properties}, then a {@code .env} file in the working directory.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    public static final String DEFAULT_IAM_TOKEN_URL = "https://iam.bluemix.net/oidc/token";
    private static final int DEFAULT_TIMEOUT_SECONDS = 60;

    private static final Path PROPERTIES_FILE = Path.of(System.getProperty("user.home"), ".couch-session", "couch.properties");
    private static final Path DOT_ENV_FILE = Path.of(".env");

    private static final Set<String> KNOWN_KEYS = Set.of(
            "COUCH_URL",
            "COUCH_USERNAME",
            "COUCH_PASSWORD",
            "IAM_API_KEY",
            "IAM_TOKEN_URL",
            "COUCH_TIMEOUT_SECONDS",
            "COUCH_AUTO_RENEW",
            "COUCH_SERVICE_NAME",
            "VCAP_SERVICES"
    );

    private static final Map<String, String> cache = new ConcurrentHashMap<>();
    private static final List<String> loadedSources = new ArrayList<>();
    private static boolean initialized;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) return;
        initialized = true;

        // lowest precedence first, later sources overwrite
        loadFromDotEnvIfPresent(DOT_ENV_FILE);
        loadFromPropertiesIfPresent(PROPERTIES_FILE);
        for (String key : KNOWN_KEYS) {
            String value = System.getenv(key);
            if (value != null && !value.isBlank()) {
                cache.put(key, value.trim());
            }
        }
        loadedSources.add("environment");
    }

    private static void loadFromDotEnvIfPresent(Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                int idx = trimmed.indexOf('=');
                if (idx <= 0) continue;
                String key = trimmed.substring(0, idx).trim();
                if (!KNOWN_KEYS.contains(key)) continue;
                String value = stripQuotes(trimmed.substring(idx + 1).trim());
                if (!value.isEmpty()) {
                    cache.put(key, value);
                }
            }
            loadedSources.add(file.toString());
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
        }
    }

    private static void loadFromPropertiesIfPresent(Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            if (KNOWN_KEYS.contains(key) && value != null && !value.isBlank()) {
                cache.put(key, value.trim());
            }
        }
        loadedSources.add(file.toString());
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String get(String key) {
        loadIfNeeded();
        return cache.get(key);
    }

    public static String getCouchUrl() {
        return get("COUCH_URL");
    }

    public static String getUsername() {
        return get("COUCH_USERNAME");
    }

    public static String getPassword() {
        return get("COUCH_PASSWORD");
    }

    public static String getIamApiKey() {
        return get("IAM_API_KEY");
    }

    public static String getIamTokenUrl() {
        String url = get("IAM_TOKEN_URL");
        return url != null ? url : DEFAULT_IAM_TOKEN_URL;
    }

    public static String getServiceName() {
        return get("COUCH_SERVICE_NAME");
    }

    public static String getVcapServices() {
        return get("VCAP_SERVICES");
    }

    public static Duration getTimeout() {
        String raw = get("COUCH_TIMEOUT_SECONDS");
        if (raw == null) {
            return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        }
        try {
            int seconds = Integer.parseInt(raw.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid COUCH_TIMEOUT_SECONDS value '{}'", raw);
            return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        }
    }

    /** Off unless {@code COUCH_AUTO_RENEW=true}. */
    public static boolean isAutoRenew() {
        String raw = get("COUCH_AUTO_RENEW");
        return raw != null && Boolean.parseBoolean(raw.trim());
    }

    public static boolean hasIamApiKey() {
        String key = getIamApiKey();
        return key != null && !key.isBlank();
    }

    public static boolean hasCookieCredentials() {
        String user = getUsername();
        String pass = getPassword();
        return user != null && !user.isBlank() && pass != null;
    }

    public static void printStatus() {
        loadIfNeeded();
        log.info("Config sources: {}", loadedSources);
        log.info("Server URL: {}", getCouchUrl() != null ? withoutUserInfo(getCouchUrl()) : (getVcapServices() != null ? "from VCAP_SERVICES" : "not set"));
        log.info("Authentication: {}", hasIamApiKey() ? "IAM" : (hasCookieCredentials() ? "cookie" : "none"));
        log.info("IAM token URL: {}", getIamTokenUrl());
        log.info("Timeout: {}s, auto renew: {}", getTimeout().getSeconds(), isAutoRenew());
    }

    private static String withoutUserInfo(String url) {
        int scheme = url.indexOf("://");
        int at = url.indexOf('@');
        int path = url.indexOf('/', scheme < 0 ? 0 : scheme + 3);
        if (scheme < 0 || at < 0 || (path >= 0 && at > path)) {
            return url;
        }
        return url.substring(0, scheme + 3) + url.substring(at + 1);
    }
}
