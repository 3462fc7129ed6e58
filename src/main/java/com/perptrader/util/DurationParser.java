package com.perptrader.util;

import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human run-limit durations: {@code "10h"}, {@code "30min"}, {@code "5m"},
 * {@code "45s"}, {@code "1d"}, or a plain number of seconds. {@code "m"} means minutes.
 */
public final class DurationParser {

    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\s*(d|h|min|m|s)?");

    private DurationParser() {}

    /**
     * @throws BusinessException VALIDATION_ERROR on a blank, negative or unrecognized value
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Duration must not be blank");
        }
        Matcher matcher = FORMAT.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Unrecognized duration: " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "s" : matcher.group(2);
        return switch (unit) {
            case "d" -> Duration.ofDays(amount);
            case "h" -> Duration.ofHours(amount);
            case "min", "m" -> Duration.ofMinutes(amount);
            default -> Duration.ofSeconds(amount);
        };
    }

    /** Like {@link #parse} but returns null for a null or blank value. */
    public static Duration parseOptional(String value) {
        return value == null || value.isBlank() ? null : parse(value);
    }
}
