package com.ryuqq.dealstore.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Query filter over deals: a conjunction of independent, optional predicates.
 *
 * <p>Every predicate left unset matches everything, so {@link #all()} matches every
 * deal. Predicates that depend on "today" are evaluated against the reference date the
 * caller passes to {@link #matches(Deal, LocalDate)}; the filter never reads the
 * wall clock.</p>
 *
 * <p><strong>Predicates:</strong></p>
 * <ul>
 *   <li>searchText: case-insensitive substring over dealName, accountName, contactName, dealId, owner</li>
 *   <li>stages: set membership</li>
 *   <li>owner / region / productLine / promoCode: case-insensitive equality</li>
 *   <li>minAmount / maxAmount: inclusive; a deal without an amount fails either bound</li>
 *   <li>closeDateFrom / closeDateTo: inclusive; a deal without a close date fails either bound</li>
 *   <li>nextStepDueBefore: due date on or before the bound (undated deals pass)</li>
 *   <li>overdueNextStep: due date strictly before the reference date</li>
 *   <li>noContactDays: never contacted, or last contact at least N days before the reference date</li>
 *   <li>tags: the deal's tags contain every requested tag (case-insensitive)</li>
 *   <li>promoterId: exact match; hasPromoter: presence or absence of a promoterId</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * DealFilter filter = DealFilter.builder()
 *     .owner("Alice")
 *     .minAmount(new BigDecimal("50000"))
 *     .build();
 * List&lt;Deal&gt; big = repository.query(filter, LocalDate.of(2025, 3, 15));
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class DealFilter {

    private static final DealFilter ALL = builder().build();

    private final String searchText;
    private final Set<DealStage> stages;
    private final String owner;
    private final String region;
    private final String productLine;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;
    private final LocalDate closeDateFrom;
    private final LocalDate closeDateTo;
    private final LocalDate nextStepDueBefore;
    private final boolean overdueNextStep;
    private final Integer noContactDays;
    private final List<String> tags;
    private final String promoterId;
    private final String promoCode;
    private final Boolean hasPromoter;

    private DealFilter(Builder b) {
        this.searchText = b.searchText;
        this.stages = b.stages.isEmpty() ? Set.of() : Set.copyOf(b.stages);
        this.owner = b.owner;
        this.region = b.region;
        this.productLine = b.productLine;
        this.minAmount = b.minAmount;
        this.maxAmount = b.maxAmount;
        this.closeDateFrom = b.closeDateFrom;
        this.closeDateTo = b.closeDateTo;
        this.nextStepDueBefore = b.nextStepDueBefore;
        this.overdueNextStep = b.overdueNextStep;
        this.noContactDays = b.noContactDays;
        this.tags = List.copyOf(b.tags);
        this.promoterId = b.promoterId;
        this.promoCode = b.promoCode;
        this.hasPromoter = b.hasPromoter;
    }

    public static DealFilter all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates every set predicate against the deal.
     *
     * @param deal deal to test
     * @param referenceDate date that "overdue" and "days since contact" are measured from
     * @return true if the deal satisfies all set predicates
     * @throws IllegalArgumentException if deal or referenceDate is null
     */
    public boolean matches(Deal deal, LocalDate referenceDate) {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate cannot be null");
        }
        return matchesSearch(deal)
            && (stages.isEmpty() || stages.contains(deal.getStage()))
            && equalsIgnoreCaseIfSet(owner, deal.getOwner())
            && equalsIgnoreCaseIfSet(region, deal.getRegion())
            && equalsIgnoreCaseIfSet(productLine, deal.getProductLine())
            && matchesAmount(deal.getAmountGbp())
            && matchesCloseDate(deal.getCloseDate())
            && matchesNextStepDue(deal.getNextStepDueDate(), referenceDate)
            && matchesNoContact(deal.getLastContactedDate(), referenceDate)
            && matchesTags(deal.getTags())
            && matchesPromoter(deal);
    }

    private boolean matchesSearch(Deal deal) {
        if (isBlank(searchText)) {
            return true;
        }
        String needle = searchText.toLowerCase(Locale.ROOT);
        return contains(deal.getDealName(), needle)
            || contains(deal.getAccountName(), needle)
            || contains(deal.getContactName(), needle)
            || contains(deal.getDealId(), needle)
            || contains(deal.getOwner(), needle);
    }

    private boolean matchesAmount(BigDecimal amount) {
        if (minAmount != null && (amount == null || amount.compareTo(minAmount) < 0)) {
            return false;
        }
        return maxAmount == null || (amount != null && amount.compareTo(maxAmount) <= 0);
    }

    private boolean matchesCloseDate(LocalDate closeDate) {
        if (closeDateFrom != null && (closeDate == null || closeDate.isBefore(closeDateFrom))) {
            return false;
        }
        return closeDateTo == null || (closeDate != null && !closeDate.isAfter(closeDateTo));
    }

    private boolean matchesNextStepDue(LocalDate due, LocalDate referenceDate) {
        if (nextStepDueBefore != null && due != null && due.isAfter(nextStepDueBefore)) {
            return false;
        }
        return !overdueNextStep || (due != null && due.isBefore(referenceDate));
    }

    private boolean matchesNoContact(LocalDate lastContacted, LocalDate referenceDate) {
        if (noContactDays == null || lastContacted == null) {
            return true;
        }
        return ChronoUnit.DAYS.between(lastContacted, referenceDate) >= noContactDays;
    }

    private boolean matchesTags(List<String> dealTags) {
        for (String wanted : tags) {
            boolean found = dealTags.stream().anyMatch(t -> t.equalsIgnoreCase(wanted));
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesPromoter(Deal deal) {
        if (!isBlank(promoterId) && !promoterId.equals(deal.getPromoterId())) {
            return false;
        }
        if (!equalsIgnoreCaseIfSet(promoCode, deal.getPromoCode())) {
            return false;
        }
        return hasPromoter == null || hasPromoter == !isBlank(deal.getPromoterId());
    }

    private static boolean equalsIgnoreCaseIfSet(String expected, String actual) {
        return isBlank(expected) || expected.equalsIgnoreCase(actual);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getSearchText() {
        return searchText;
    }

    public Set<DealStage> getStages() {
        return stages;
    }

    public String getOwner() {
        return owner;
    }

    public BigDecimal getMinAmount() {
        return minAmount;
    }

    public BigDecimal getMaxAmount() {
        return maxAmount;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "DealFilter{" +
            "searchText='" + searchText + '\'' +
            ", stages=" + stages +
            ", owner='" + owner + '\'' +
            ", region='" + region + '\'' +
            ", minAmount=" + minAmount +
            ", maxAmount=" + maxAmount +
            ", overdueNextStep=" + overdueNextStep +
            ", noContactDays=" + noContactDays +
            ", tags=" + tags +
            ", promoterId='" + promoterId + '\'' +
            '}';
    }

    /**
     * Builder for {@link DealFilter}. Each setter narrows the result set.
     */
    public static final class Builder {

        private String searchText;
        private final Set<DealStage> stages = EnumSet.noneOf(DealStage.class);
        private String owner;
        private String region;
        private String productLine;
        private BigDecimal minAmount;
        private BigDecimal maxAmount;
        private LocalDate closeDateFrom;
        private LocalDate closeDateTo;
        private LocalDate nextStepDueBefore;
        private boolean overdueNextStep;
        private Integer noContactDays;
        private final List<String> tags = new ArrayList<>();
        private String promoterId;
        private String promoCode;
        private Boolean hasPromoter;

        private Builder() {
        }

        public Builder searchText(String searchText) {
            this.searchText = searchText;
            return this;
        }

        public Builder stages(Collection<DealStage> stages) {
            this.stages.clear();
            this.stages.addAll(stages);
            return this;
        }

        public Builder stage(DealStage stage) {
            this.stages.add(stage);
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder productLine(String productLine) {
            this.productLine = productLine;
            return this;
        }

        public Builder minAmount(BigDecimal minAmount) {
            this.minAmount = minAmount;
            return this;
        }

        public Builder maxAmount(BigDecimal maxAmount) {
            this.maxAmount = maxAmount;
            return this;
        }

        public Builder closeDateFrom(LocalDate closeDateFrom) {
            this.closeDateFrom = closeDateFrom;
            return this;
        }

        public Builder closeDateTo(LocalDate closeDateTo) {
            this.closeDateTo = closeDateTo;
            return this;
        }

        public Builder nextStepDueBefore(LocalDate nextStepDueBefore) {
            this.nextStepDueBefore = nextStepDueBefore;
            return this;
        }

        public Builder overdueNextStep(boolean overdueNextStep) {
            this.overdueNextStep = overdueNextStep;
            return this;
        }

        public Builder noContactDays(int noContactDays) {
            if (noContactDays < 0) {
                throw new IllegalArgumentException(
                    "noContactDays must not be negative (current: " + noContactDays + ")"
                );
            }
            this.noContactDays = noContactDays;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder promoterId(String promoterId) {
            this.promoterId = promoterId;
            return this;
        }

        public Builder promoCode(String promoCode) {
            this.promoCode = promoCode;
            return this;
        }

        public Builder hasPromoter(boolean hasPromoter) {
            this.hasPromoter = hasPromoter;
            return this;
        }

        public DealFilter build() {
            if (minAmount != null && maxAmount != null && minAmount.compareTo(maxAmount) > 0) {
                throw new IllegalArgumentException(
                    "minAmount must be <= maxAmount (min: " + minAmount + ", max: " + maxAmount + ")"
                );
            }
            return new DealFilter(this);
        }
    }
}
