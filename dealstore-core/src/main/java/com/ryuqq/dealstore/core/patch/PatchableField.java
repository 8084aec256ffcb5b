package com.ryuqq.dealstore.core.patch;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealStage;
import com.ryuqq.dealstore.core.normalize.FieldParsers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One entry of the patch whitelist: a field name bound to its parser, getter and setter.
 *
 * <p>The whitelist is a static table built once at class load. Field names are matched
 * case-insensitively; {@code "Amount"} is accepted as an alias of {@code AmountGBP}.
 * The key and the derived fields (DealId, PostcodeArea, Region, MapLink, WeightedAmountGBP)
 * are not in the table; {@link DealPatcher} rejects them with a specific reason.</p>
 *
 * <p>Writing Postcode clears PostcodeArea, Region and MapLink, and writing
 * InstallationLocation clears MapLink, so the next normalization pass re-derives them.</p>
 *
 * @param <T> field value type
 * @author DealStore Team
 * @since 1.0.0
 */
final class PatchableField<T> {

    private static final Map<String, PatchableField<?>> REGISTRY = buildRegistry();

    private final String name;
    private final Function<Object, ParsedValue<T>> parser;
    private final Function<Deal, T> getter;
    private final BiConsumer<Deal, T> setter;

    private PatchableField(
        String name,
        Function<Object, ParsedValue<T>> parser,
        Function<Deal, T> getter,
        BiConsumer<Deal, T> setter
    ) {
        this.name = name;
        this.parser = parser;
        this.getter = getter;
        this.setter = setter;
    }

    static Optional<PatchableField<?>> lookup(String requestedName) {
        if (requestedName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(requestedName.toLowerCase(Locale.ROOT)));
    }

    static Map<String, PatchableField<?>> registry() {
        return REGISTRY;
    }

    String name() {
        return name;
    }

    ParsedValue<T> parse(Object raw) {
        return parser.apply(raw);
    }

    AppliedField write(Deal deal, T value) {
        String oldText = toText(getter.apply(deal));
        setter.accept(deal, value);
        return new AppliedField(name, oldText, toText(value));
    }

    // ============================================================
    // Registry
    // ============================================================

    private static Map<String, PatchableField<?>> buildRegistry() {
        Map<String, PatchableField<?>> m = new LinkedHashMap<>();
        text(m, "OrderNo", Deal::getOrderNo, Deal::setOrderNo);
        text(m, "UserId", Deal::getUserId, Deal::setUserId);
        register(m, "AccountName", requiredText("AccountName"), Deal::getAccountName, Deal::setAccountName);
        text(m, "ContactName", Deal::getContactName, Deal::setContactName);
        text(m, "Email", Deal::getEmail, Deal::setEmail);
        text(m, "Phone", Deal::getPhone, Deal::setPhone);
        text(m, "Postcode", Deal::getPostcode, (d, v) -> {
            d.setPostcode(v);
            d.setPostcodeArea(null);
            d.setRegion(null);
            d.setMapLink(null);
        });
        text(m, "InstallationLocation", Deal::getInstallationLocation, (d, v) -> {
            d.setInstallationLocation(v);
            d.setMapLink(null);
        });
        text(m, "LeadSource", Deal::getLeadSource, Deal::setLeadSource);
        text(m, "ProductLine", Deal::getProductLine, Deal::setProductLine);
        register(m, "DealName", requiredText("DealName"), Deal::getDealName, Deal::setDealName);
        register(m, "Stage", PatchableField::parseStage, Deal::getStage, Deal::setStage);
        register(m, "Probability", PatchableField::parseProbability, Deal::getProbability, Deal::setProbability);
        PatchableField<BigDecimal> amount = new PatchableField<>("AmountGBP",
            raw -> parseMoney(raw, "amount", "Amount"), Deal::getAmountGbp, Deal::setAmountGbp);
        m.put("amountgbp", amount);
        m.put("amount", amount);
        text(m, "Owner", Deal::getOwner, Deal::setOwner);
        date(m, "CreatedDate", Deal::getCreatedDate, Deal::setCreatedDate);
        date(m, "LastContactedDate", Deal::getLastContactedDate, Deal::setLastContactedDate);
        text(m, "NextStep", Deal::getNextStep, Deal::setNextStep);
        date(m, "NextStepDueDate", Deal::getNextStepDueDate, Deal::setNextStepDueDate);
        date(m, "CloseDate", Deal::getCloseDate, Deal::setCloseDate);
        text(m, "ServicePlan", Deal::getServicePlan, Deal::setServicePlan);
        date(m, "LastServiceDate", Deal::getLastServiceDate, Deal::setLastServiceDate);
        date(m, "NextServiceDueDate", Deal::getNextServiceDueDate, Deal::setNextServiceDueDate);
        text(m, "Comments", Deal::getComments, Deal::setComments);
        register(m, "Tags", PatchableField::parseTags, Deal::getTags, Deal::setTags);
        text(m, "PromoterId", Deal::getPromoterId, Deal::setPromoterId);
        text(m, "PromoCode", Deal::getPromoCode, Deal::setPromoCode);
        register(m, "PromoterCommission", raw -> parseMoney(raw, "commission", "Commission"),
            Deal::getPromoterCommission, Deal::setPromoterCommission);
        register(m, "CommissionPaid", PatchableField::parseCommissionPaid,
            Deal::isCommissionPaid, Deal::setCommissionPaid);
        date(m, "CommissionPaidDate", Deal::getCommissionPaidDate, Deal::setCommissionPaidDate);
        return Collections.unmodifiableMap(m);
    }

    private static <T> void register(
        Map<String, PatchableField<?>> m,
        String name,
        Function<Object, ParsedValue<T>> parser,
        Function<Deal, T> getter,
        BiConsumer<Deal, T> setter
    ) {
        m.put(name.toLowerCase(Locale.ROOT), new PatchableField<>(name, parser, getter, setter));
    }

    private static void text(Map<String, PatchableField<?>> m, String name,
                             Function<Deal, String> getter, BiConsumer<Deal, String> setter) {
        register(m, name, raw -> ParsedValue.accepted(raw == null ? null : raw.toString()), getter, setter);
    }

    private static void date(Map<String, PatchableField<?>> m, String name,
                             Function<Deal, LocalDate> getter, BiConsumer<Deal, LocalDate> setter) {
        register(m, name, PatchableField::parseDate, getter, setter);
    }

    // ============================================================
    // Parsers
    // ============================================================

    private static Function<Object, ParsedValue<String>> requiredText(String name) {
        return raw -> raw == null
            ? ParsedValue.rejected(name + " cannot be cleared")
            : ParsedValue.accepted(raw.toString());
    }

    private static ParsedValue<DealStage> parseStage(Object raw) {
        if (raw == null) {
            return ParsedValue.rejected("Stage cannot be cleared");
        }
        if (raw instanceof DealStage stage) {
            return ParsedValue.accepted(stage);
        }
        return DealStage.tryParse(raw.toString())
            .<ParsedValue<DealStage>>map(ParsedValue::accepted)
            .orElseGet(() -> ParsedValue.rejected("Unknown stage: " + raw));
    }

    private static ParsedValue<Integer> parseProbability(Object raw) {
        if (raw == null) {
            return ParsedValue.rejected("Probability cannot be cleared");
        }
        int value;
        try {
            BigDecimal number = new BigDecimal(raw.toString().trim());
            value = number.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return ParsedValue.rejected("Invalid probability value");
        }
        if (value < 0 || value > 100) {
            return ParsedValue.rejected("Probability must be between 0 and 100");
        }
        return ParsedValue.accepted(value);
    }

    private static ParsedValue<BigDecimal> parseMoney(Object raw, String noun, String label) {
        if (raw == null) {
            return ParsedValue.accepted(null);
        }
        Optional<BigDecimal> parsed = raw instanceof BigDecimal decimal
            ? Optional.of(decimal)
            : FieldParsers.parseAmount(raw.toString());
        if (parsed.isEmpty()) {
            return ParsedValue.rejected("Invalid " + noun + " value");
        }
        if (parsed.get().signum() < 0) {
            return ParsedValue.rejected(label + " cannot be negative");
        }
        return ParsedValue.accepted(parsed.get());
    }

    private static ParsedValue<LocalDate> parseDate(Object raw) {
        if (raw == null) {
            return ParsedValue.accepted(null);
        }
        if (raw instanceof LocalDate date) {
            return ParsedValue.accepted(date);
        }
        return FieldParsers.parseDate(raw.toString())
            .<ParsedValue<LocalDate>>map(ParsedValue::accepted)
            .orElseGet(() -> ParsedValue.rejected("Invalid date format"));
    }

    private static ParsedValue<Boolean> parseCommissionPaid(Object raw) {
        if (raw instanceof Boolean flag) {
            return ParsedValue.accepted(flag);
        }
        Optional<Boolean> parsed = raw == null ? Optional.empty() : FieldParsers.parseBoolean(raw.toString());
        return parsed
            .<ParsedValue<Boolean>>map(ParsedValue::accepted)
            .orElseGet(() -> ParsedValue.rejected("Invalid boolean value for CommissionPaid"));
    }

    private static ParsedValue<List<String>> parseTags(Object raw) {
        if (raw == null) {
            return ParsedValue.accepted(new ArrayList<>());
        }
        if (raw instanceof Collection<?> items) {
            List<String> tags = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    tags.add(item.toString().trim());
                }
            }
            return ParsedValue.accepted(tags);
        }
        if (raw instanceof String text) {
            List<String> tags = new ArrayList<>();
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    tags.add(part.trim());
                }
            }
            return ParsedValue.accepted(tags);
        }
        return ParsedValue.rejected("Tags must be a list or comma-separated string");
    }

    static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof DealStage stage) {
            return stage.getDisplayName();
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            list.forEach(item -> parts.add(String.valueOf(item)));
            return String.join(", ", parts);
        }
        return value.toString();
    }
}
