package com.switchboard.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * How a provider expects its API key on outbound requests.
 */
@FunctionalInterface
public interface AuthScheme {

    void apply(HttpHeaders headers, UriComponentsBuilder uri, String apiKey);

    /** {@code Authorization: Bearer <key>} */
    static AuthScheme bearer() {
        return (headers, uri, apiKey) -> headers.setBearerAuth(apiKey);
    }

    /** {@code Authorization: Token <key>} */
    static AuthScheme token() {
        return (headers, uri, apiKey) -> headers.set(HttpHeaders.AUTHORIZATION, "Token " + apiKey);
    }

    /** Key in a provider-specific header, e.g. {@code x-api-key}. */
    static AuthScheme header(String name) {
        return (headers, uri, apiKey) -> headers.set(name, apiKey);
    }

    /** Key as a query parameter, e.g. {@code ?key=}. */
    static AuthScheme queryParameter(String name) {
        return (headers, uri, apiKey) -> uri.queryParam(name, apiKey);
    }

    /** Requests are signed elsewhere (SDK clients). */
    static AuthScheme none() {
        return (headers, uri, apiKey) -> { };
    }
}
