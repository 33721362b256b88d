package com.bidradar.score;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of deadline text to {@code YYYY-MM-DD}. Ambiguous or partial dates come
 * back as {@code null} rather than guessed. No calendar validation happens here. Text that already
 * starts with an ISO date is returned untouched, trailing text and whitespace included.
 */
@Component
public class DeadlineNormalizer {
    private static final Pattern ISO_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern US_SLASH = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");
    private static final Pattern MONTH_NAME = Pattern.compile(
        "([A-Z][a-z]+)\\s+(\\d{1,2}),\\s+(\\d{4})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Map<String, String> MONTHS = Map.ofEntries(
        Map.entry("january", "01"),
        Map.entry("february", "02"),
        Map.entry("march", "03"),
        Map.entry("april", "04"),
        Map.entry("may", "05"),
        Map.entry("june", "06"),
        Map.entry("july", "07"),
        Map.entry("august", "08"),
        Map.entry("september", "09"),
        Map.entry("october", "10"),
        Map.entry("november", "11"),
        Map.entry("december", "12")
    );

    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (ISO_PREFIX.matcher(text).lookingAt()) {
            return text;
        }
        String value = text.trim();

        Matcher us = US_SLASH.matcher(value);
        if (us.lookingAt()) {
            return us.group(3) + "-" + pad(us.group(1)) + "-" + pad(us.group(2));
        }

        Matcher named = MONTH_NAME.matcher(value);
        if (named.lookingAt()) {
            String month = MONTHS.get(named.group(1).toLowerCase(Locale.ROOT));
            if (month != null) {
                return named.group(3) + "-" + month + "-" + pad(named.group(2));
            }
        }
        return null;
    }

    private static String pad(String digits) {
        return digits.length() == 1 ? "0" + digits : digits;
    }
}
