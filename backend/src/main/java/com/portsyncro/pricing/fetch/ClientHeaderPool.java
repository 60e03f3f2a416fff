package com.portsyncro.pricing.fetch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Small pool of client identification headers; each attempt picks one at random so naive upstream filters
 * see varied clients. Cosmetic robustness only.
 */
public class ClientHeaderPool {

    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0";
    private static final List<String> ACCEPT_LANGUAGES = List.of("en-US,en;q=0.9", "id-ID,id;q=0.9,en;q=0.8", "en-GB,en;q=0.8");

    private final List<String> userAgents;

    public ClientHeaderPool(List<String> userAgents) {
        this.userAgents = userAgents == null || userAgents.isEmpty() ? List.of(DEFAULT_USER_AGENT) : List.copyOf(userAgents);
    }

    public Map<String, String> forJson() {
        return headers("application/json");
    }

    public Map<String, String> forHtml() {
        return headers("text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
    }

    private Map<String, String> headers(String accept) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgents.get(r.nextInt(userAgents.size())));
        headers.put("Accept", accept);
        headers.put("Accept-Language", ACCEPT_LANGUAGES.get(r.nextInt(ACCEPT_LANGUAGES.size())));
        headers.put("Cache-Control", "no-cache");
        return headers;
    }

    public List<String> getUserAgents() {
        return userAgents;
    }
}
