package com.pushit.util;

/** Application constants */
public final class Constants {

    public static final String API_BASE_PATH = "/api/v1";

    public static final String PAYSTACK_SIGNATURE_HEADER = "X-Paystack-Signature";

    private Constants() {
        // Utility class - no instantiation
    }
}
