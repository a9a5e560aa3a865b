package com.batterysmart.swap_ledger.driver;

import com.batterysmart.swap_ledger.exception.InvalidInputException;

/**
 * Languages a driver can be served in.
 */
public enum Language {
    HINDI("hi"),
    ENGLISH("en"),
    HINGLISH("hi-en");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return HINGLISH;
        }
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        throw new InvalidInputException("preferredLanguage",
                "Unsupported language: " + code + " (expected hi, en or hi-en)");
    }
}
