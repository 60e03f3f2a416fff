package com.portsyncro.pricing.fetch;

/**
 * Successful (2xx) upstream response body.
 */
public record RawResponse(int status, String body) {

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
