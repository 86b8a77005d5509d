package com.couchsession;

import com.couchsession.auth.AuthSession;
import com.couchsession.auth.BasicSession;
import com.couchsession.auth.CookieSession;
import com.couchsession.auth.IamSession;
import com.couchsession.error.ConfigurationException;
import com.couchsession.http.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Picks the session type from whatever credentials are configured:
 * an IAM API key wins over username/password, and with neither the session is unauthenticated.
 */
public final class SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SessionFactory.class);

    private SessionFactory() {}

    public static AuthSession fromConfig() {
        Config.printStatus();
        String url = Config.getCouchUrl();
        String username = Config.getUsername();
        String password = Config.getPassword();

        if (url == null || url.isBlank()) {
            String vcap = Config.getVcapServices();
            if (vcap == null || vcap.isBlank()) {
                throw new ConfigurationException("No server configured: set COUCH_URL or VCAP_SERVICES");
            }
            ServiceBinding binding = ServiceBinding.parse(vcap, Config.getServiceName());
            log.info("Using bound service {} at {}", binding.name(), binding.host());
            url = binding.url().toString();
            if (username == null) username = binding.username();
            if (password == null) password = binding.password();
        }

        URI serverUrl;
        try {
            serverUrl = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid server URL: " + url, e);
        }
        return create(serverUrl, username, password, Config.getIamApiKey(), Config.getTimeout(), Config.isAutoRenew());
    }

    public static AuthSession create(URI serverUrl, String username, String password, String iamApiKey,
                                     Duration timeout, boolean autoRenew) {
        RequestDispatcher dispatcher = new RequestDispatcher(timeout);
        if (iamApiKey != null && !iamApiKey.isBlank()) {
            log.debug("Creating IAM session for {}", serverUrl);
            return new IamSession(iamApiKey, serverUrl, dispatcher, autoRenew, null);
        }
        if (username != null && !username.isBlank() && password != null) {
            log.debug("Creating cookie session for {}", serverUrl);
            return new CookieSession(username, password, serverUrl, dispatcher, autoRenew);
        }
        log.debug("Creating unauthenticated session for {}", serverUrl);
        return new BasicSession(serverUrl, null, null, dispatcher);
    }
}
