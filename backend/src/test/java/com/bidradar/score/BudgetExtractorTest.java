package com.bidradar.score;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetExtractorTest {
    private final BudgetExtractor extractor = new BudgetExtractor();

    @Test
    void readsMillionSuffix() {
        assertThat(extractor.extract("$1.2M available")).isEqualByComparingTo("1200000");
        assertThat(extractor.extract("Up to $3 million in funding")).isEqualByComparingTo("3000000");
    }

    @Test
    void readsUsdMarkerWithThousandSuffix() {
        assertThat(extractor.extract("USD 75K")).isEqualByComparingTo("75000");
    }

    @Test
    void stripsDigitGroupSeparators() {
        assertThat(extractor.extract("Budget: $500,000")).isEqualByComparingTo("500000");
        assertThat(extractor.extract("Ceiling USD 2,500,000 total")).isEqualByComparingTo("2500000");
    }

    @Test
    void noCurrencyMentionYieldsNull() {
        assertThat(extractor.extract("no budget mentioned")).isNull();
        assertThat(extractor.extract("")).isNull();
        assertThat(extractor.extract(null)).isNull();
    }

    @Test
    void higherPriorityPatternWinsEvenWhenItAppearsLater() {
        BigDecimal value = extractor.extract("Phase one $40,000; total program $2M");
        assertThat(value).isEqualByComparingTo("2000000");
    }

    @Test
    void dollarAmountsBeatUsdAmounts() {
        assertThat(extractor.extract("USD 5M ceiling, $20,000 seed")).isEqualByComparingTo("20000");
    }

    @Test
    void suffixMustEndTheWord() {
        assertThat(extractor.extract("$50 monthly fee")).isEqualByComparingTo("50");
    }

    @Test
    void unparseableMatchFallsThroughToNextPattern() {
        assertThat(extractor.extract("$, USD 10K")).isEqualByComparingTo("10000");
    }
}
