package com.regatta.scoring;

import com.regatta.web.RegattaValidationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Race clock strings: {@code M:SS.cc} or {@code SS.cc}, hundredths optional.
 * Minutes take at most three digits.
 */
public final class RaceTimeFormat {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(?:(\\d{1,3}):)?(\\d{1,2})(?:\\.(\\d{1,3}))?$");

    private RaceTimeFormat() {
    }

    public static long parseToMillis(String value) {
        if (value == null || value.isBlank()) {
            throw new RegattaValidationException("invalid_results", "Race time is required");
        }
        Matcher matcher = TIME_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new RegattaValidationException("invalid_results", "Unparseable race time: " + value);
        }
        long minutes = matcher.group(1) == null ? 0 : Long.parseLong(matcher.group(1));
        long seconds = Long.parseLong(matcher.group(2));
        if (matcher.group(1) != null && seconds >= 60) {
            throw new RegattaValidationException("invalid_results", "Seconds out of range in race time: " + value);
        }
        long fraction = 0;
        String fractionDigits = matcher.group(3);
        if (fractionDigits != null) {
            String padded = (fractionDigits + "00").substring(0, 3);
            fraction = Long.parseLong(padded);
        }
        return minutes * 60_000 + seconds * 1_000 + fraction;
    }

    public static String format(Long millis) {
        if (millis == null) {
            return null;
        }
        long minutes = millis / 60_000;
        long seconds = (millis % 60_000) / 1_000;
        long hundredths = (millis % 1_000) / 10;
        if (minutes > 0) {
            return String.format("%d:%02d.%02d", minutes, seconds, hundredths);
        }
        return String.format("%d.%02d", seconds, hundredths);
    }
}
