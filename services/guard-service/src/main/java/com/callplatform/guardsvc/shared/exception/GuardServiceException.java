package com.callplatform.guardsvc.shared.exception;

/**
 * Base sealed exception for Guard Service programming and input errors.
 * Guard decisions on proxied traffic are never exceptions; they are returned as decisions.
 */
public sealed abstract class GuardServiceException extends RuntimeException
        permits InvalidRequestException, RuleNotFoundException, RateLimitedException {

    protected GuardServiceException(String message) {
        super(message);
    }

    protected GuardServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();
}
