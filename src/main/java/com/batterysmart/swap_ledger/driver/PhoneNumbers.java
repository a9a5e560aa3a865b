package com.batterysmart.swap_ledger.driver;

import com.batterysmart.swap_ledger.exception.InvalidInputException;

import java.util.regex.Pattern;

/**
 * Normalizes Indian mobile numbers to their ten-digit form.
 *
 * Accepts spaces, dashes, a leading 0 and a +91 / 91 country prefix.
 */
public final class PhoneNumbers {

    private static final Pattern MOBILE = Pattern.compile("^[6-9]\\d{9}$");

    private PhoneNumbers() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("phoneNumber", "Phone number is required");
        }

        String digits = raw.replaceAll("[\\s\\-()]", "");
        if (digits.startsWith("+91")) {
            digits = digits.substring(3);
        } else if (digits.length() == 12 && digits.startsWith("91")) {
            digits = digits.substring(2);
        } else if (digits.length() == 11 && digits.startsWith("0")) {
            digits = digits.substring(1);
        }

        if (!MOBILE.matcher(digits).matches()) {
            throw new InvalidInputException("phoneNumber", "Not a valid mobile number: " + raw);
        }
        return digits;
    }
}
