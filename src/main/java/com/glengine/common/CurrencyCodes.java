package com.glengine.common;

import java.util.regex.Pattern;

/**
 * ISO-4217 currency code checks.
 *
 * Codes are kept as strings so that tenants can post in any currency their
 * exchange-rate source supports; only the shape is validated here.
 */
public final class CurrencyCodes {

    private static final Pattern ISO_4217 = Pattern.compile("[A-Z]{3}");

    private CurrencyCodes() {
    }

    public static boolean isValid(String code) {
        return code != null && ISO_4217.matcher(code).matches();
    }
}
