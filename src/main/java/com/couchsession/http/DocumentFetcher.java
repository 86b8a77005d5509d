package com.couchsession.http;

import com.couchsession.auth.AuthSession;
import com.couchsession.error.OptionConversionException;
import com.couchsession.query.ParameterCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads document listings ({@code _all_docs}, views) through a session.
 *
 * <p>A {@code keys} option turns the call into a POST with {@code {"keys": [...]}} as the body;
 * everything else goes through {@link ParameterCodec} onto the query string.
 */
public final class DocumentFetcher {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private DocumentFetcher() {}

    public static HttpResponse<String> getDocs(AuthSession session, URI url, Map<String, ?> params)
            throws IOException, InterruptedException {
        return getDocs(session, url, null, null, params);
    }

    /**
     * @param encoder mapper used to write the keys body, or null for a default one
     * @param headers extra headers, may be null
     * @throws com.couchsession.error.HttpStatusException when the server answers with an error status
     */
    public static HttpResponse<String> getDocs(AuthSession session, URI url, ObjectMapper encoder,
                                               Map<String, String> headers, Map<String, ?> params)
            throws IOException, InterruptedException {
        Map<String, Object> remaining = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        Object keys = remaining.remove("keys");
        String keysBody = null;
        if (keys != null) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("keys", keys);
            try {
                keysBody = (encoder != null ? encoder : DEFAULT_MAPPER).writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new OptionConversionException("keys", e);
            }
        }

        RequestOptions.Builder options = RequestOptions.builder()
                .headers(headers)
                .query(ParameterCodec.translate(remaining));

        HttpResponse<String> response;
        if (keysBody != null) {
            options.jsonBody(keysBody);
            response = session.request("POST", url, options.build());
        } else {
            response = session.request("GET", url, options.build());
        }
        ResponseErrors.raiseForStatus(response);
        return response;
    }
}
