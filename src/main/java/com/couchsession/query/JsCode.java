package com.couchsession.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * JavaScript source (map, reduce or filter functions) kept apart from ordinary strings
 * so design document content is never mistaken for a plain value.
 */
public record JsCode(String source) {

    public JsCode {
        Objects.requireNonNull(source, "source");
    }

    public static JsCode codify(Object codeOrString) {
        if (codeOrString == null) {
            return null;
        }
        if (codeOrString instanceof JsCode code) {
            return code;
        }
        return new JsCode(codeOrString.toString());
    }

    @JsonValue
    @Override
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
