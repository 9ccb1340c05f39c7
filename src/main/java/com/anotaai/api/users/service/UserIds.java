package com.anotaai.api.users.service;

import com.anotaai.api.common.web.ValidationException;

import java.util.regex.Pattern;

/** Path-segment ids: 1 to 19 digits, no leading zero, must fit a long. */
public final class UserIds {

    private static final Pattern WELL_FORMED = Pattern.compile("[1-9]\\d{0,18}");

    private UserIds() {}

    public static boolean isWellFormed(String raw) {
        if (raw == null || !WELL_FORMED.matcher(raw).matches()) return false;
        try {
            Long.parseLong(raw);
            return true;
        } catch (NumberFormatException e) {
            return false; // 19 digits above Long.MAX_VALUE
        }
    }

    public static long parse(String raw) {
        if (!isWellFormed(raw)) {
            throw new ValidationException("Invalid user ID format");
        }
        return Long.parseLong(raw);
    }
}
