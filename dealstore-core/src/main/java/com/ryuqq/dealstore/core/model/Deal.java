package com.ryuqq.dealstore.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A single sales opportunity, the record unit of the store.
 *
 * <p>Deals are keyed by {@code dealId}. Keys are compared case-insensitively by every
 * repository implementation.</p>
 *
 * <p><strong>Field Groups:</strong></p>
 * <ul>
 *   <li>Identity: dealId, orderNo, userId</li>
 *   <li>Account/contact: accountName, contactName, email, phone</li>
 *   <li>Location: postcode, postcodeArea (derived), installationLocation, region, mapLink</li>
 *   <li>Value: stage, probability, amountGbp, weighted amount (computed, never stored)</li>
 *   <li>Scheduling: createdDate, lastContactedDate, nextStep, nextStepDueDate, closeDate</li>
 *   <li>Service: servicePlan, lastServiceDate, nextServiceDueDate</li>
 *   <li>Promoter attribution: promoterId, promoCode, promoterCommission, commissionPaid</li>
 * </ul>
 *
 * <p><strong>Ownership:</strong> Deal is a mutable working object. Repositories never hand
 * out their stored instance; callers receive a {@link #copy()} and write changes back
 * through {@code upsert}.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class Deal {
    private String dealId = "";
    private String orderNo;
    private String userId;
    private String accountName;
    private String contactName;
    private String email;
    private String phone;
    private String postcode;
    private String postcodeArea;
    private String installationLocation;
    private String region;
    private String mapLink;
    private String leadSource;
    private String productLine;
    private String dealName;
    private DealStage stage = DealStage.LEAD;
    private int probability;
    private BigDecimal amountGbp;
    private String owner;
    private LocalDate createdDate;
    private LocalDate lastContactedDate;
    private String nextStep;
    private LocalDate nextStepDueDate;
    private LocalDate closeDate;
    private String servicePlan;
    private LocalDate lastServiceDate;
    private LocalDate nextServiceDueDate;
    private String comments;
    private List<String> tags = new ArrayList<>();
    private String promoterId;
    private String promoCode;
    private BigDecimal promoterCommission;
    private boolean commissionPaid;
    private LocalDate commissionPaidDate;

    public Deal() {
    }

    /**
     * Creates a deal with its key and the two names every persisted row carries.
     *
     * @param dealId deal key (empty means "generate on normalization")
     * @param accountName account name
     * @param dealName deal name
     * @return new deal at stage LEAD
     */
    public static Deal of(String dealId, String accountName, String dealName) {
        Deal deal = new Deal();
        deal.setDealId(dealId);
        deal.setAccountName(accountName);
        deal.setDealName(dealName);
        return deal;
    }

    /**
     * Weighted pipeline value: {@code amountGbp × probability / 100}.
     *
     * @return weighted amount rounded to pence, or null when no amount is set
     */
    public BigDecimal getWeightedAmountGbp() {
        if (amountGbp == null) {
            return null;
        }
        return amountGbp.multiply(BigDecimal.valueOf(probability))
            .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }

    /**
     * Copies this deal. The tag list is copied too, so the copy shares no mutable state.
     *
     * @return independent copy
     */
    public Deal copy() {
        Deal c = new Deal();
        c.dealId = dealId;
        c.orderNo = orderNo;
        c.userId = userId;
        c.accountName = accountName;
        c.contactName = contactName;
        c.email = email;
        c.phone = phone;
        c.postcode = postcode;
        c.postcodeArea = postcodeArea;
        c.installationLocation = installationLocation;
        c.region = region;
        c.mapLink = mapLink;
        c.leadSource = leadSource;
        c.productLine = productLine;
        c.dealName = dealName;
        c.stage = stage;
        c.probability = probability;
        c.amountGbp = amountGbp;
        c.owner = owner;
        c.createdDate = createdDate;
        c.lastContactedDate = lastContactedDate;
        c.nextStep = nextStep;
        c.nextStepDueDate = nextStepDueDate;
        c.closeDate = closeDate;
        c.servicePlan = servicePlan;
        c.lastServiceDate = lastServiceDate;
        c.nextServiceDueDate = nextServiceDueDate;
        c.comments = comments;
        c.tags = new ArrayList<>(tags);
        c.promoterId = promoterId;
        c.promoCode = promoCode;
        c.promoterCommission = promoterCommission;
        c.commissionPaid = commissionPaid;
        c.commissionPaidDate = commissionPaidDate;
        return c;
    }

    public String getDealId() {
        return dealId;
    }

    public void setDealId(String dealId) {
        this.dealId = dealId == null ? "" : dealId;
    }

    public String getOrderNo() {
        return orderNo;
    }

    public void setOrderNo(String orderNo) {
        this.orderNo = orderNo;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getAccountName() {
        return accountName;
    }

    public void setAccountName(String accountName) {
        this.accountName = accountName;
    }

    public String getContactName() {
        return contactName;
    }

    public void setContactName(String contactName) {
        this.contactName = contactName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getPostcode() {
        return postcode;
    }

    public void setPostcode(String postcode) {
        this.postcode = postcode;
    }

    public String getPostcodeArea() {
        return postcodeArea;
    }

    public void setPostcodeArea(String postcodeArea) {
        this.postcodeArea = postcodeArea;
    }

    public String getInstallationLocation() {
        return installationLocation;
    }

    public void setInstallationLocation(String installationLocation) {
        this.installationLocation = installationLocation;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getMapLink() {
        return mapLink;
    }

    public void setMapLink(String mapLink) {
        this.mapLink = mapLink;
    }

    public String getLeadSource() {
        return leadSource;
    }

    public void setLeadSource(String leadSource) {
        this.leadSource = leadSource;
    }

    public String getProductLine() {
        return productLine;
    }

    public void setProductLine(String productLine) {
        this.productLine = productLine;
    }

    public String getDealName() {
        return dealName;
    }

    public void setDealName(String dealName) {
        this.dealName = dealName;
    }

    public DealStage getStage() {
        return stage;
    }

    public void setStage(DealStage stage) {
        this.stage = stage == null ? DealStage.LEAD : stage;
    }

    public int getProbability() {
        return probability;
    }

    public void setProbability(int probability) {
        this.probability = probability;
    }

    public BigDecimal getAmountGbp() {
        return amountGbp;
    }

    public void setAmountGbp(BigDecimal amountGbp) {
        this.amountGbp = amountGbp;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public LocalDate getCreatedDate() {
        return createdDate;
    }

    public void setCreatedDate(LocalDate createdDate) {
        this.createdDate = createdDate;
    }

    public LocalDate getLastContactedDate() {
        return lastContactedDate;
    }

    public void setLastContactedDate(LocalDate lastContactedDate) {
        this.lastContactedDate = lastContactedDate;
    }

    public String getNextStep() {
        return nextStep;
    }

    public void setNextStep(String nextStep) {
        this.nextStep = nextStep;
    }

    public LocalDate getNextStepDueDate() {
        return nextStepDueDate;
    }

    public void setNextStepDueDate(LocalDate nextStepDueDate) {
        this.nextStepDueDate = nextStepDueDate;
    }

    public LocalDate getCloseDate() {
        return closeDate;
    }

    public void setCloseDate(LocalDate closeDate) {
        this.closeDate = closeDate;
    }

    public String getServicePlan() {
        return servicePlan;
    }

    public void setServicePlan(String servicePlan) {
        this.servicePlan = servicePlan;
    }

    public LocalDate getLastServiceDate() {
        return lastServiceDate;
    }

    public void setLastServiceDate(LocalDate lastServiceDate) {
        this.lastServiceDate = lastServiceDate;
    }

    public LocalDate getNextServiceDueDate() {
        return nextServiceDueDate;
    }

    public void setNextServiceDueDate(LocalDate nextServiceDueDate) {
        this.nextServiceDueDate = nextServiceDueDate;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }

    public String getPromoterId() {
        return promoterId;
    }

    public void setPromoterId(String promoterId) {
        this.promoterId = promoterId;
    }

    public String getPromoCode() {
        return promoCode;
    }

    public void setPromoCode(String promoCode) {
        this.promoCode = promoCode;
    }

    public BigDecimal getPromoterCommission() {
        return promoterCommission;
    }

    public void setPromoterCommission(BigDecimal promoterCommission) {
        this.promoterCommission = promoterCommission;
    }

    public boolean isCommissionPaid() {
        return commissionPaid;
    }

    public void setCommissionPaid(boolean commissionPaid) {
        this.commissionPaid = commissionPaid;
    }

    public LocalDate getCommissionPaidDate() {
        return commissionPaidDate;
    }

    public void setCommissionPaidDate(LocalDate commissionPaidDate) {
        this.commissionPaidDate = commissionPaidDate;
    }

    /**
     * Field-by-field equality. Decimal fields compare by value, so {@code 1000} equals
     * {@code 1000.00}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Deal)) {
            return false;
        }
        Deal other = (Deal) o;
        return Objects.equals(dealId, other.dealId)
            && Objects.equals(orderNo, other.orderNo)
            && Objects.equals(userId, other.userId)
            && Objects.equals(accountName, other.accountName)
            && Objects.equals(contactName, other.contactName)
            && Objects.equals(email, other.email)
            && Objects.equals(phone, other.phone)
            && Objects.equals(postcode, other.postcode)
            && Objects.equals(postcodeArea, other.postcodeArea)
            && Objects.equals(installationLocation, other.installationLocation)
            && Objects.equals(region, other.region)
            && Objects.equals(mapLink, other.mapLink)
            && Objects.equals(leadSource, other.leadSource)
            && Objects.equals(productLine, other.productLine)
            && Objects.equals(dealName, other.dealName)
            && Objects.equals(stage, other.stage)
            && probability == other.probability
            && compareAmounts(amountGbp, other.amountGbp)
            && Objects.equals(owner, other.owner)
            && Objects.equals(createdDate, other.createdDate)
            && Objects.equals(lastContactedDate, other.lastContactedDate)
            && Objects.equals(nextStep, other.nextStep)
            && Objects.equals(nextStepDueDate, other.nextStepDueDate)
            && Objects.equals(closeDate, other.closeDate)
            && Objects.equals(servicePlan, other.servicePlan)
            && Objects.equals(lastServiceDate, other.lastServiceDate)
            && Objects.equals(nextServiceDueDate, other.nextServiceDueDate)
            && Objects.equals(comments, other.comments)
            && Objects.equals(tags, other.tags)
            && Objects.equals(promoterId, other.promoterId)
            && Objects.equals(promoCode, other.promoCode)
            && compareAmounts(promoterCommission, other.promoterCommission)
            && commissionPaid == other.commissionPaid
            && Objects.equals(commissionPaidDate, other.commissionPaidDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dealId.toLowerCase(Locale.ROOT), accountName, dealName, stage, probability);
    }

    @Override
    public String toString() {
        return "Deal{" +
            "dealId='" + dealId + '\'' +
            ", accountName='" + accountName + '\'' +
            ", dealName='" + dealName + '\'' +
            ", stage=" + stage +
            ", probability=" + probability +
            ", amountGbp=" + amountGbp +
            '}';
    }

    private static boolean compareAmounts(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
