package com.anotaai.api.users.dto;

import com.anotaai.api.common.web.ValidationException;

/**
 * page/limit from the query string. Absent or empty means default; anything else must be a
 * plain decimal number in range.
 */
public record PageQuery(int page, int limit) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) throw new ValidationException("Parameter page must be a positive number");
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("Parameter limit must be a number between 1 and 100");
        }
    }

    public static PageQuery parse(String rawPage, String rawLimit) {
        Integer page = parseInt(rawPage);
        if (rawPage != null && !rawPage.isBlank() && (page == null || page < 1)) {
            throw new ValidationException("Parameter page must be a positive number");
        }
        Integer limit = parseInt(rawLimit);
        if (rawLimit != null && !rawLimit.isBlank() && (limit == null || limit < 1 || limit > MAX_LIMIT)) {
            throw new ValidationException("Parameter limit must be a number between 1 and 100");
        }
        return new PageQuery(page == null ? DEFAULT_PAGE : page, limit == null ? DEFAULT_LIMIT : limit);
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    private static Integer parseInt(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        if (!s.matches("-?\\d{1,9}")) return null;
        return Integer.parseInt(s);
    }
}
