package com.callplatform.guardsvc.domain.ratelimit;

import com.callplatform.guardsvc.domain.model.UserContext;

/**
 * Chooses the key that scopes limits and behavior tracking for a request.
 */
@FunctionalInterface
public interface IdentifierResolver {

    /** {@code user:{userId}} for authenticated callers, {@code ip:{ipAddress}} otherwise. */
    IdentifierResolver DEFAULT = context -> context.authenticated()
            ? "user:" + context.userId()
            : "ip:" + context.ipAddress();

    String resolve(UserContext context);
}
