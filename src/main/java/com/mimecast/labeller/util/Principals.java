package com.mimecast.labeller.util;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Principal helpers.
 */
public final class Principals {

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private Principals() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Short SHA-256 of the principal for log correlation without exposing the address.
     *
     * @param principal Principal.
     * @return First 12 hex characters.
     */
    public static String hash(String principal) {
        if (principal == null) {
            return "none";
        }
        return DigestUtils.sha256Hex(principal.toLowerCase(Locale.ROOT)).substring(0, 12);
    }

    /**
     * Checks if the principal is a well formed address.
     *
     * @param principal Principal.
     * @return Boolean.
     */
    public static boolean isValid(String principal) {
        return StringUtils.isNotBlank(principal) && EMAIL.matcher(principal).matches();
    }
}
