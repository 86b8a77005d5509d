package com.couchsession.auth;

import com.couchsession.http.RenewalStrategy;
import com.couchsession.http.ResponseErrors;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Reactive renewal for cookie sessions: log in again only after the server has said no.
 */
final class CookieRenewal implements RenewalStrategy {

    static final String CREDENTIALS_EXPIRED = "credentials_expired";

    private final CookieSession session;

    CookieRenewal(CookieSession session) {
        this.session = session;
    }

    @Override
    public boolean isExpired(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 401) {
            return true;
        }
        return status == 403 && CREDENTIALS_EXPIRED.equals(ResponseErrors.errorField(response));
    }

    @Override
    public void renew() throws IOException, InterruptedException {
        session.login();
    }
}
