package com.ryuqq.dealstore.application.deal;

import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;
import com.ryuqq.dealstore.core.model.DealStage;
import com.ryuqq.dealstore.core.normalize.DealNormalizer;
import com.ryuqq.dealstore.core.normalize.NormalizationResult;
import com.ryuqq.dealstore.core.patch.PatchResult;
import com.ryuqq.dealstore.core.spi.DealRepository;
import com.ryuqq.dealstore.testkit.fixture.DealFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultDealService 유닛 테스트 (repository는 Mockito mock).
 *
 * @author DealStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultDealServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

    @Mock
    private DealRepository repository;

    private DefaultDealService service;

    @BeforeEach
    void setUp() {
        DealNormalizer normalizer = new DealNormalizer(LookupTables.createDefault(), SystemContext.forTesting(TODAY));
        service = new DefaultDealService(repository, normalizer);
    }

    // ============================================================
    // Upsert
    // ============================================================

    @Test
    void upsert_normalizesThenStoresThenCommits() {
        Deal deal = new Deal();
        deal.setAccountName("Acme");
        deal.setDealName("Roof");
        deal.setStage(DealStage.PROPOSAL);
        deal.setPostcode("SW1A 1AA");

        NormalizationResult result = service.upsert(deal);

        assertThat(result.deal().getDealId()).isEqualTo("D-20250315-00000001");
        assertThat(result.deal().getProbability()).isEqualTo(60);
        ArgumentCaptor<Deal> stored = ArgumentCaptor.forClass(Deal.class);
        InOrder order = inOrder(repository);
        order.verify(repository).upsert(stored.capture());
        order.verify(repository).saveChanges();
        assertThat(stored.getValue().getRegion()).isEqualTo("London");
    }

    @Test
    void importDeals_commitsOnce() {
        List<NormalizationResult> results = service.importDeals(List.of(new Deal(), new Deal()));

        assertThat(results).extracting(r -> r.deal().getDealId())
            .containsExactly("D-20250315-00000001", "D-20250315-00000002");
        verify(repository).upsertMany(any());
        verify(repository).saveChanges();
    }

    @Test
    void search_usesContextDateAsReference() {
        DealFilter filter = DealFilter.builder().overdueNextStep(true).build();

        service.search(filter);

        verify(repository).query(filter, TODAY);
    }

    // ============================================================
    // Patch
    // ============================================================

    @Test
    @DisplayName("부분 성공: Owner 적용, InvalidField/Probability 150 거부, 커밋됨")
    void patch_partialSuccess() {
        Deal existing = DealFixtures.deal("D-001");
        when(repository.getById("D-001")).thenReturn(Optional.of(existing));
        Map<String, Object> fields = new HashMap<>();
        fields.put("Owner", "Alice");
        fields.put("InvalidField", "x");
        fields.put("Probability", 150);

        PatchResult result = service.patch("D-001", fields);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Partial success: 2 field(s) rejected");
        assertThat(result.appliedFields()).extracting(a -> a.field()).containsExactly("Owner");
        assertThat(result.rejectedFields()).extracting(r -> r.reason())
            .containsExactlyInAnyOrder("Unknown field: InvalidField", "Probability must be between 0 and 100");
        assertThat(result.deal().getOwner()).isEqualTo("Alice");
        assertThat(result.deal().getProbability()).isEqualTo(10);
        verify(repository).upsert(any(Deal.class));
        verify(repository).saveChanges();
    }

    @Test
    void patch_allRejected_savesNothing() {
        when(repository.getById("D-001")).thenReturn(Optional.of(DealFixtures.deal("D-001")));

        PatchResult result = service.patch("D-001", Map.of("DealId", "D-999", "Region", "Mars"));

        assertThat(result.success()).isFalse();
        assertThat(result.deal()).isNull();
        assertThat(result.error()).isEqualTo("Validation failed for 2 field(s)");
        verify(repository, never()).upsert(any());
        verify(repository, never()).saveChanges();
    }

    @Test
    void patch_missingDeal_isNotFound() {
        when(repository.getById(anyString())).thenReturn(Optional.empty());

        PatchResult result = service.patch("D-404", Map.of("Owner", "Alice"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Deal not found: D-404");
        verify(repository, never()).saveChanges();
    }

    @Test
    void patch_emptyMap_succeedsWithoutCommit() {
        when(repository.getById("D-001")).thenReturn(Optional.of(DealFixtures.deal("D-001")));

        PatchResult result = service.patch("D-001", Map.of());

        assertThat(result.success()).isTrue();
        assertThat(result.appliedFields()).isEmpty();
        verify(repository, never()).saveChanges();
    }

    @Test
    void patch_postcode_rederivesLocationFields() {
        Deal existing = DealFixtures.fullyPopulated("D-001");
        when(repository.getById("D-001")).thenReturn(Optional.of(existing));

        PatchResult result = service.patch("D-001", Map.of("Postcode", "M1 1AE"));

        assertThat(result.success()).isTrue();
        assertThat(result.deal().getPostcodeArea()).isEqualTo("M");
        assertThat(result.deal().getRegion()).isEqualTo("North West");
        assertThat(result.deal().getMapLink()).contains("M1%201AE");
        assertThat(result.normalizationChanges()).extracting(c -> c.field())
            .contains("PostcodeArea", "Region", "MapLink");
    }

    // ============================================================
    // Delete
    // ============================================================

    @Test
    void delete_existing_commits() {
        when(repository.getById("D-001")).thenReturn(Optional.of(DealFixtures.deal("D-001")));

        assertThat(service.delete("D-001")).isTrue();

        verify(repository).delete(eq("D-001"));
        verify(repository).saveChanges();
    }

    @Test
    void delete_missing_doesNotCommit() {
        when(repository.getById("D-404")).thenReturn(Optional.empty());

        assertThat(service.delete("D-404")).isFalse();

        verify(repository, never()).delete(anyString());
        verify(repository, never()).saveChanges();
    }
}
