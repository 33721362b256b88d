package com.bidradar.score;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first currency mention in free text and converts it to a USD figure.
 * Patterns are tried in priority order; the first pattern that matches anywhere in the text wins.
 */
@Component
public class BudgetExtractor {
    private static final String AMOUNT = "([\\d,]+(?:\\.\\d+)?)";
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);

    private static final List<AmountPattern> PATTERNS = List.of(
        new AmountPattern("\\$\\s*" + AMOUNT + "\\s*m(?:illion)?\\b", MILLION),
        new AmountPattern("\\$\\s*" + AMOUNT + "\\s*k\\b", THOUSAND),
        new AmountPattern("\\$\\s*" + AMOUNT, BigDecimal.ONE),
        new AmountPattern("USD\\s*" + AMOUNT + "\\s*m(?:illion)?\\b", MILLION),
        new AmountPattern("USD\\s*" + AMOUNT + "\\s*k\\b", THOUSAND),
        new AmountPattern("USD\\s*" + AMOUNT, BigDecimal.ONE)
    );

    public BigDecimal extract(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (AmountPattern candidate : PATTERNS) {
            Matcher matcher = candidate.pattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String digits = matcher.group(1).replace(",", "");
            try {
                return new BigDecimal(digits).multiply(candidate.multiplier());
            } catch (NumberFormatException ignored) {
                // "$," and similar: fall through to the next pattern
            }
        }
        return null;
    }

    private record AmountPattern(Pattern pattern, BigDecimal multiplier) {
        AmountPattern(String regex, BigDecimal multiplier) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), multiplier);
        }
    }
}
