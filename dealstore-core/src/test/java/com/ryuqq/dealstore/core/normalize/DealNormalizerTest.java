package com.ryuqq.dealstore.core.normalize;

import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DealNormalizer 유닛 테스트.
 *
 * <p>규칙별 동작, 변경 추적, 결정성 및 fixed point 성질을 검증합니다.</p>
 */
class DealNormalizerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

    private DealNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DealNormalizer(LookupTables.createDefault(), SystemContext.forTesting(TODAY));
    }

    // ============================================================
    // 1. 결정성 예제
    // ============================================================

    @Test
    @DisplayName("빈 ID, Proposal, 확률 0, SW1A 1AA → 모든 파생 필드가 결정적으로 채워짐")
    void normalize_fillsEveryDerivedFieldDeterministically() {
        // Given
        Deal deal = Deal.of("", "Acme", "Solar roof");
        deal.setStage(DealStage.PROPOSAL);
        deal.setProbability(0);
        deal.setPostcode("SW1A 1AA");

        // When
        NormalizationResult result = normalizer.normalizeWithTracking(deal);

        // Then
        Deal d = result.deal();
        assertThat(d.getDealId()).isEqualTo("D-20250315-00000001");
        assertThat(d.getProbability()).isEqualTo(60);
        assertThat(d.getPostcodeArea()).isEqualTo("SW");
        assertThat(d.getRegion()).isEqualTo("London");
        assertThat(d.getMapLink()).contains("SW1A%201AA");
        assertThat(d.getCreatedDate()).isEqualTo(TODAY);
        assertThat(result.changes())
            .extracting(NormalizationChange::field)
            .containsExactly("DealId", "Probability", "PostcodeArea", "Region", "MapLink", "CreatedDate");
    }

    @Test
    void normalize_doesNotMutateInput() {
        Deal deal = Deal.of("", "Acme", "Solar roof");
        deal.setPostcode("M1 2AB");

        normalizer.normalize(deal);

        assertThat(deal.getDealId()).isEmpty();
        assertThat(deal.getRegion()).isNull();
        assertThat(deal.getCreatedDate()).isNull();
    }

    // ============================================================
    // 2. 규칙별 동작
    // ============================================================

    @Test
    void existingRegion_isKept() {
        Deal deal = normalizedBase();
        deal.setPostcode("SW1A 1AA");
        deal.setRegion("Head Office");

        Deal d = normalizer.normalize(deal);

        assertThat(d.getRegion()).isEqualTo("Head Office");
        assertThat(d.getPostcodeArea()).isEqualTo("SW");
    }

    @Test
    void mapLink_includesInstallationLocation() {
        Deal deal = normalizedBase();
        deal.setPostcode("SW1A 2AA");
        deal.setInstallationLocation("10 Downing St");

        Deal d = normalizer.normalize(deal);

        assertThat(d.getMapLink()).isEqualTo(
            "https://www.google.com/maps/search/?api=1&query=10%20Downing%20St%2C%20SW1A%202AA");
    }

    @Test
    @DisplayName("문자로 시작하지 않는 우편번호는 area를 null로 두고 재정규화 시 변경 없음")
    void postcodeWithoutLetters_leavesAreaUnset() {
        Deal deal = normalizedBase();
        deal.setPostcode("123");

        NormalizationResult first = normalizer.normalizeWithTracking(deal);

        assertThat(first.deal().getPostcodeArea()).isNull();
        assertThat(first.deal().getRegion()).isNull();
        assertThat(first.changes()).extracting(NormalizationChange::field).containsExactly("MapLink");
        assertThat(normalizer.normalizeWithTracking(first.deal()).hasChanges()).isFalse();
    }

    @Test
    void staleArea_isClearedWhenPostcodeHasNoLetters() {
        Deal deal = normalizedBase();
        deal.setPostcode("123");
        deal.setPostcodeArea("SW");

        NormalizationResult result = normalizer.normalizeWithTracking(deal);

        assertThat(result.deal().getPostcodeArea()).isNull();
        assertThat(result.changes()).extracting(NormalizationChange::field).contains("PostcodeArea");
    }

    @Test
    void explicitProbability_isKept() {
        Deal deal = normalizedBase();
        deal.setStage(DealStage.PROPOSAL);
        deal.setProbability(35);

        assertThat(normalizer.normalize(deal).getProbability()).isEqualTo(35);
    }

    @Test
    void closedLostWithZeroProbability_recordsNoChange() {
        Deal deal = normalizedBase();
        deal.setStage(DealStage.CLOSED_LOST);
        deal.setProbability(0);

        NormalizationResult result = normalizer.normalizeWithTracking(deal);

        assertThat(result.hasChanges()).isFalse();
        assertThat(result.deal().getProbability()).isZero();
    }

    @Test
    void tags_areTrimmedAndDeduplicatedCaseInsensitively() {
        Deal deal = normalizedBase();
        deal.setTags(Arrays.asList(" Solar ", "solar", "", "Battery", "SOLAR", "  "));

        NormalizationResult result = normalizer.normalizeWithTracking(deal);

        assertThat(result.deal().getTags()).containsExactly("Solar", "Battery");
        assertThat(result.changes()).singleElement()
            .satisfies(c -> {
                assertThat(c.field()).isEqualTo("Tags");
                assertThat(c.newValue()).isEqualTo("Solar, Battery");
            });
    }

    @Test
    void generatedIdsFollowTheSequence() {
        Deal first = normalizer.normalize(Deal.of("", "A", "a"));
        Deal second = normalizer.normalize(Deal.of("", "B", "b"));

        assertThat(first.getDealId()).isEqualTo("D-20250315-00000001");
        assertThat(second.getDealId()).isEqualTo("D-20250315-00000002");
    }

    @Test
    void nullDeal_isRejected() {
        assertThatThrownBy(() -> normalizer.normalizeWithTracking(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("deal cannot be null");
    }

    // ============================================================
    // 3. Fixed point
    // ============================================================

    @Test
    @DisplayName("정규화 결과를 다시 정규화하면 변경이 없음 (무작위 입력 500건)")
    void secondPass_isAlwaysANoOp() {
        Random random = new Random(42);
        String[] postcodes = {null, "", "SW1A 1AA", "m1 2ab", "ZZ9 9ZZ", "12345", " eh1 1yz "};
        String[] locations = {null, "", "Unit 4, Mill Lane"};
        String[][] tagSets = {{}, {"a", "A", " b "}, {"", "  "}, {"solar"}};

        for (int i = 0; i < 500; i++) {
            Deal deal = Deal.of(random.nextBoolean() ? "" : "D-X-" + i, "Acct", "Deal");
            deal.setStage(DealStage.values()[random.nextInt(DealStage.values().length)]);
            deal.setProbability(random.nextInt(4) == 0 ? 0 : random.nextInt(101));
            deal.setPostcode(postcodes[random.nextInt(postcodes.length)]);
            deal.setInstallationLocation(locations[random.nextInt(locations.length)]);
            deal.setRegion(random.nextInt(3) == 0 ? "Custom" : null);
            deal.setCreatedDate(random.nextBoolean() ? null : TODAY.minusDays(random.nextInt(100)));
            deal.setTags(new ArrayList<>(List.of(tagSets[random.nextInt(tagSets.length)])));

            NormalizationResult first = normalizer.normalizeWithTracking(deal);
            NormalizationResult second = normalizer.normalizeWithTracking(first.deal());

            assertThat(second.changes()).as("second pass for input %s", deal).isEmpty();
            assertThat(second.deal()).isEqualTo(first.deal());
        }
    }

    private static Deal normalizedBase() {
        Deal deal = Deal.of("D-20250101-AAAAAAAA", "Acme", "Solar roof");
        deal.setProbability(10);
        deal.setCreatedDate(LocalDate.of(2025, 1, 1));
        return deal;
    }
}
