package com.callplatform.guardsvc.infrastructure.captcha;

/**
 * The CAPTCHA vendor could not be asked (timeout, transport error, open breaker).
 * Callers treat this as a failed verification.
 */
public class CaptchaVendorException extends RuntimeException {

    public CaptchaVendorException(String message, Throwable cause) {
        super(message, cause);
    }

    public CaptchaVendorException(String message) {
        super(message);
    }
}
