package com.couchsession.auth;

import com.couchsession.http.RenewalStrategy;

import java.io.IOException;
import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.http.HttpResponse;

/**
 * Proactive renewal for IAM sessions. Token exchange costs two round trips, so a login happens
 * as soon as no live {@code IAMSession} cookie is held instead of waiting for a 401.
 */
final class IamRenewal implements RenewalStrategy {

    static final String SESSION_COOKIE = "IAMSession";

    private final IamSession session;
    private final CookieStore cookies;

    IamRenewal(IamSession session, CookieStore cookies) {
        this.session = session;
        this.cookies = cookies;
    }

    @Override
    public void beforeRequest() {
        clearExpired(cookies);
    }

    @Override
    public boolean renewBeforeRequest() {
        return !hasLiveCookie(cookies, SESSION_COOKIE);
    }

    @Override
    public boolean isExpired(HttpResponse<String> response) {
        return response.statusCode() == 401;
    }

    @Override
    public void renew() throws IOException, InterruptedException {
        session.login();
    }

    /**
     * Removes expired cookies. The JDK in-memory store already prunes them on read, so this only
     * does work for stores that return expired entries.
     */
    static void clearExpired(CookieStore store) {
        for (HttpCookie cookie : store.getCookies()) {
            if (cookie.hasExpired()) {
                store.remove(null, cookie);
            }
        }
    }

    static boolean hasLiveCookie(CookieStore store, String name) {
        for (HttpCookie cookie : store.getCookies()) {
            if (name.equals(cookie.getName()) && !cookie.hasExpired()) {
                return true;
            }
        }
        return false;
    }
}
