package com.portsyncro.api;

import com.portsyncro.pricing.config.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Rate-limit identity of a caller: {@code user:<id>} when a user id is supplied, otherwise
 * {@code ip:<address>|<user agent>}. A user id keeps people behind one shared address from throttling each other.
 * <p>
 * The user id is not authenticated here. It is only as trustworthy as whatever sits in front of this service
 * (an auth gateway that sets X-User-Id from a verified token); {@code portsyncro.rate-limit.trust-client-user-id=false}
 * ignores it and keys every caller by address.
 */
@Component
@RequiredArgsConstructor
public class CallerIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    private static final int MAX_AGENT_LENGTH = 120;

    private final RateLimitProperties rateLimitProperties;

    public String resolve(String headerUserId, String bodyUserId, ServerHttpRequest request) {
        String userId = rateLimitProperties.isTrustClientUserId() ? firstNonBlank(headerUserId, bodyUserId) : null;
        if (userId != null) {
            return "user:" + userId.strip();
        }
        String agent = request.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        if (agent == null || agent.isBlank()) {
            agent = "unknown";
        } else if (agent.length() > MAX_AGENT_LENGTH) {
            agent = agent.substring(0, MAX_AGENT_LENGTH);
        }
        return "ip:" + clientAddress(request) + "|" + agent;
    }

    private static String clientAddress(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].strip();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        return b != null && !b.isBlank() ? b : null;
    }
}
