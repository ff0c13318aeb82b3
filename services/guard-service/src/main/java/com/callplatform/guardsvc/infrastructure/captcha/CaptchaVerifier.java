package com.callplatform.guardsvc.infrastructure.captcha;

/**
 * Opaque vendor check: one call per verification attempt.
 */
public interface CaptchaVerifier {

    /**
     * @throws CaptchaVendorException when the vendor cannot be reached
     */
    VendorVerification verify(String response, String remoteIp);

    /** Vendor-agnostic name surfaced to clients, e.g. {@code hcaptcha}. */
    String captchaType();
}
