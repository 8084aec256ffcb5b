package com.ryuqq.dealstore.testkit.fixture;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealStage;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Ready-made deals for tests.
 *
 * <p>Fixtures are already normalized (id, probability, area, region, map link and created
 * date set), so storing and reloading them produces no normalization changes.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class DealFixtures {

    private DealFixtures() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * A minimal normalized deal with the given id.
     */
    public static Deal deal(String dealId) {
        Deal deal = Deal.of(dealId, "Account " + dealId, "Deal " + dealId);
        deal.setStage(DealStage.LEAD);
        deal.setProbability(10);
        deal.setCreatedDate(LocalDate.of(2025, 1, 1));
        return deal;
    }

    /**
     * A deal with every field populated, including promoter attribution.
     */
    public static Deal fullyPopulated(String dealId) {
        Deal deal = Deal.of(dealId, "Riverside Farm", "Ground source heat pump");
        deal.setOrderNo("ORD-1001");
        deal.setUserId("U-17");
        deal.setContactName("Jane Smith");
        deal.setEmail("jane@riverside.example");
        deal.setPhone("07700 900123");
        deal.setPostcode("SW1A 1AA");
        deal.setPostcodeArea("SW");
        deal.setInstallationLocation("Mill Lane");
        deal.setRegion("London");
        deal.setMapLink("https://www.google.com/maps/search/?api=1&query=Mill%20Lane%2C%20SW1A%201AA");
        deal.setLeadSource("Referral");
        deal.setProductLine("Heat Pumps");
        deal.setStage(DealStage.PROPOSAL);
        deal.setProbability(60);
        deal.setAmountGbp(new BigDecimal("12500.50"));
        deal.setOwner("Alice");
        deal.setCreatedDate(LocalDate.of(2025, 1, 10));
        deal.setLastContactedDate(LocalDate.of(2025, 3, 1));
        deal.setNextStep("Send revised quote");
        deal.setNextStepDueDate(LocalDate.of(2025, 3, 20));
        deal.setCloseDate(LocalDate.of(2025, 4, 30));
        deal.setServicePlan("Gold");
        deal.setLastServiceDate(LocalDate.of(2024, 11, 5));
        deal.setNextServiceDueDate(LocalDate.of(2025, 11, 5));
        deal.setComments("Prefers email, \"no calls\" after 5pm");
        deal.setTags(List.of("heat-pump", "grant"));
        deal.setPromoterId("P-7");
        deal.setPromoCode("SAVE20");
        deal.setPromoterCommission(new BigDecimal("250.00"));
        deal.setCommissionPaid(true);
        deal.setCommissionPaidDate(LocalDate.of(2025, 2, 1));
        return deal;
    }

    /**
     * Deals D-001 .. D-{count}, minimal and normalized.
     */
    public static List<Deal> deals(int count) {
        Deal[] deals = new Deal[count];
        for (int i = 0; i < count; i++) {
            deals[i] = deal(String.format("D-%03d", i + 1));
        }
        return List.of(deals);
    }
}
