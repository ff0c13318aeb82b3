package com.callplatform.guardsvc.api.interceptor;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.model.UserRole;
import com.callplatform.guardsvc.shared.http.IpAddresses;
import com.callplatform.guardsvc.shared.http.RequestHeaders;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-request {@link UserContext} from the servlet request and the authenticated principal.
 * Forwarding headers name the client only when the socket peer is a configured trusted proxy.
 */
@Component
public class UserContextResolver {

    /** Client-IP headers in precedence order, consulted only behind a trusted proxy. */
    static final List<String> CLIENT_IP_HEADERS = List.of(
            RequestHeaders.X_NF_CLIENT_CONNECTION_IP,
            RequestHeaders.CF_CONNECTING_IP,
            RequestHeaders.X_FORWARDED_FOR,
            RequestHeaders.X_REAL_IP,
            RequestHeaders.X_CLIENT_IP,
            RequestHeaders.X_CLUSTER_CLIENT_IP);

    private final List<String> trustedProxies;

    public UserContextResolver(GuardProperties properties) {
        this.trustedProxies = List.copyOf(properties.getOrchestration().getTrustedProxies());
    }

    public UserContext resolve(HttpServletRequest request) {
        String ip = clientIp(request);
        String userAgent = request.getHeader(RequestHeaders.USER_AGENT);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken
                || authentication.getName() == null || authentication.getName().isBlank()) {
            return UserContext.anonymous(ip).withUserAgent(userAgent);
        }
        return UserContext.authenticated(authentication.getName(), highestRole(authentication), ip)
                .withUserAgent(userAgent);
    }

    public RequestHeaders headers(HttpServletRequest request) {
        Map<String, String> raw = new HashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            raw.put(name, request.getHeader(name));
        }
        return RequestHeaders.of(raw);
    }

    String clientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }
        for (String header : CLIENT_IP_HEADERS) {
            String value = request.getHeader(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            String candidate = RequestHeaders.X_FORWARDED_FOR.equals(header)
                    ? forwardedClient(value)
                    : value.split(",")[0].trim();
            if (IpAddresses.isValid(candidate)) {
                return candidate;
            }
        }
        return remoteAddr;
    }

    boolean isTrustedProxy(String address) {
        for (String proxy : trustedProxies) {
            if (IpAddresses.matches(address, proxy)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rightmost hop that is not itself a trusted proxy.
     */
    private String forwardedClient(String value) {
        String[] hops = value.split(",");
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (!isTrustedProxy(hop)) {
                return hop;
            }
        }
        return hops[0].trim();
    }

    private static UserRole highestRole(Authentication authentication) {
        UserRole role = UserRole.BUYER;
        boolean found = false;
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            UserRole candidate = UserRole.fromClaim(authority.getAuthority());
            if (candidate == UserRole.ANONYMOUS) {
                continue;
            }
            if (!found || candidate.compareTo(role) > 0) {
                role = candidate;
                found = true;
            }
        }
        return role;
    }
}
