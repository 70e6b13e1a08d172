package com.eyelevel.mediadownloader.common.ratelimit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-written transfer rates such as {@code 500K}, {@code 2M}, {@code 1.5MiB/s} or
 * {@code unbounded} into bytes per second. Suffixes are binary multiples, as in curl's
 * {@code --limit-rate}.
 */
public final class RateLimitParser {

    /**
     * Sentinel for "no limit".
     */
    public static final long UNBOUNDED = 0L;

    private static final Set<String> UNBOUNDED_WORDS = Set.of("unbounded", "unlimited", "none", "off", "0");
    private static final Pattern RATE_PATTERN =
            Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([KMG]?)(?:I?B)?(?:/S)?$");

    private RateLimitParser() {
    }

    /**
     * @param value The configured rate.
     * @return bytes per second, or {@link #UNBOUNDED}.
     * @throws IllegalArgumentException if the value cannot be understood.
     */
    public static long parse(String value) {
        if (value == null || value.isBlank()) {
            return UNBOUNDED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (UNBOUNDED_WORDS.contains(normalized.toLowerCase(Locale.ROOT))) {
            return UNBOUNDED;
        }

        Matcher matcher = RATE_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid rate limit '" + value
                    + "'. Expected e.g. 500K, 2M, 1.5MiB/s or 'unbounded'.");
        }

        long multiplier = switch (matcher.group(2)) {
            case "K" -> 1024L;
            case "M" -> 1024L * 1024;
            case "G" -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        long bytesPerSecond;
        try {
            bytesPerSecond = new BigDecimal(matcher.group(1))
                    .multiply(BigDecimal.valueOf(multiplier))
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Rate limit '" + value + "' is too large.", e);
        }
        if (bytesPerSecond <= 0) {
            throw new IllegalArgumentException("Rate limit '" + value + "' is below one byte per second.");
        }
        return bytesPerSecond;
    }
}
