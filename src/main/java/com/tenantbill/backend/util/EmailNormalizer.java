package com.tenantbill.backend.util;

import com.tenantbill.backend.exceptions.InvalidRequestException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email addresses are stored trimmed and lowercased; uniqueness checks use the stored form.
 */
public final class EmailNormalizer {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private EmailNormalizer() {
    }

    /**
     * @throws InvalidRequestException if the address is not of the form local@domain.tld
     */
    public static String normalize(String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new InvalidRequestException("Invalid email format.");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
