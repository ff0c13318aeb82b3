package com.callplatform.guardsvc.shared.http;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable case-insensitive view over inbound request headers, with typed accessors
 * for the headers the guard inspects.
 */
public final class RequestHeaders {

    public static final String USER_AGENT = "user-agent";
    public static final String X_FORWARDED_FOR = "x-forwarded-for";
    public static final String X_REAL_IP = "x-real-ip";
    public static final String X_CLIENT_IP = "x-client-ip";
    public static final String CF_CONNECTING_IP = "cf-connecting-ip";
    public static final String X_NF_CLIENT_CONNECTION_IP = "x-nf-client-connection-ip";
    public static final String X_CLUSTER_CLIENT_IP = "x-cluster-client-ip";
    public static final String AUTHORIZATION = "authorization";

    private static final RequestHeaders EMPTY = new RequestHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final Map<String, String> values;

    private RequestHeaders(TreeMap<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static RequestHeaders empty() {
        return EMPTY;
    }

    public static RequestHeaders of(Map<String, String> raw) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (raw != null) {
            raw.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name.trim(), value);
                }
            });
        }
        return new RequestHeaders(copy);
    }

    public Optional<String> get(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Optional<String> userAgent() {
        return get(USER_AGENT);
    }

    /**
     * First hop of {@code X-Forwarded-For}, i.e. the address the client claims to originate from.
     */
    public Optional<String> forwardedFor() {
        return get(X_FORWARDED_FOR).map(RequestHeaders::firstListElement);
    }

    public Optional<String> realIp() {
        return get(X_REAL_IP).map(RequestHeaders::firstListElement);
    }

    public Optional<String> clientIp() {
        return get(X_CLIENT_IP).map(RequestHeaders::firstListElement);
    }

    public Optional<String> cfConnectingIp() {
        return get(CF_CONNECTING_IP).map(RequestHeaders::firstListElement);
    }

    public Optional<String> nfClientConnectionIp() {
        return get(X_NF_CLIENT_CONNECTION_IP).map(RequestHeaders::firstListElement);
    }

    /**
     * Distinct client addresses claimed across the client-IP headers, in header precedence order.
     */
    public Set<String> claimedClientIps() {
        Set<String> claimed = new LinkedHashSet<>();
        nfClientConnectionIp().ifPresent(claimed::add);
        cfConnectingIp().ifPresent(claimed::add);
        forwardedFor().ifPresent(claimed::add);
        realIp().ifPresent(claimed::add);
        clientIp().ifPresent(claimed::add);
        return claimed;
    }

    private static String firstListElement(String value) {
        int comma = value.indexOf(',');
        return (comma >= 0 ? value.substring(0, comma) : value).trim();
    }

    @Override
    public String toString() {
        return "RequestHeaders" + values.keySet();
    }
}
