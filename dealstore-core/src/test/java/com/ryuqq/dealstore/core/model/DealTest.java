package com.ryuqq.dealstore.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DealTest {

    @Test
    void weightedAmount_isAmountTimesProbability() {
        // Given
        Deal deal = Deal.of("D-1", "Acme", "Solar roof");
        deal.setAmountGbp(new BigDecimal("12500"));
        deal.setProbability(60);

        // When / Then
        assertThat(deal.getWeightedAmountGbp()).isEqualByComparingTo("7500");
    }

    @Test
    void weightedAmount_isNullWithoutAmount() {
        Deal deal = Deal.of("D-1", "Acme", "Solar roof");
        deal.setProbability(60);

        assertThat(deal.getWeightedAmountGbp()).isNull();
    }

    @Test
    void copy_doesNotShareTags() {
        // Given
        Deal original = Deal.of("D-1", "Acme", "Solar roof");
        original.setTags(List.of("solar"));

        // When
        Deal copy = original.copy();
        copy.getTags().add("battery");

        // Then
        assertThat(original.getTags()).containsExactly("solar");
        assertThat(copy).isNotEqualTo(original);
    }

    @Test
    void equals_comparesAmountsByValue() {
        Deal a = Deal.of("D-1", "Acme", "Solar roof");
        a.setAmountGbp(new BigDecimal("1000"));
        Deal b = a.copy();
        b.setAmountGbp(new BigDecimal("1000.00"));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void nullIdAndStageFallBackToDefaults() {
        Deal deal = new Deal();
        deal.setDealId(null);
        deal.setStage(null);

        assertThat(deal.getDealId()).isEmpty();
        assertThat(deal.getStage()).isEqualTo(DealStage.LEAD);
    }
}
