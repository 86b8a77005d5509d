package com.couchsession.http;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Decides when a session's credentials need renewing and how to renew them.
 * {@link RequestDispatcher} consults it around every request when auto renewal is on.
 */
public interface RenewalStrategy {

    RenewalStrategy NONE = new RenewalStrategy() {
        @Override
        public boolean isExpired(HttpResponse<String> response) {
            return false;
        }

        @Override
        public void renew() {
        }
    };

    /**
     * Housekeeping run before every request, whether or not auto renewal is enabled.
     */
    default void beforeRequest() {
    }

    /**
     * True when credentials are known to be missing before the request is even sent.
     */
    default boolean renewBeforeRequest() {
        return false;
    }

    boolean isExpired(HttpResponse<String> response);

    void renew() throws IOException, InterruptedException;
}
