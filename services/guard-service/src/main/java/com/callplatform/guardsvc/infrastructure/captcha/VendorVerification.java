package com.callplatform.guardsvc.infrastructure.captcha;

import java.util.List;

public record VendorVerification(boolean success, List<String> errorCodes) {

    public VendorVerification {
        errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }

    public static VendorVerification passed() {
        return new VendorVerification(true, List.of());
    }

    public static VendorVerification rejected(String... errorCodes) {
        return new VendorVerification(false, List.of(errorCodes));
    }
}
