package com.ryuqq.dealstore.adapter.file.mapping;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealStage;
import com.ryuqq.dealstore.core.normalize.FieldParsers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Maps deals to and from the {@code Deals} table.
 *
 * <p><strong>Writing:</strong> one header row with the canonical column names (in
 * {@link #COLUMNS} order) followed by one row per deal. Dates are ISO, amounts are plain
 * decimals, tags are joined with {@code ", "}, CommissionPaid is {@code Yes}/{@code No}.
 * WeightedAmountGBP is written for people reading the file and ignored on read.</p>
 *
 * <p><strong>Reading:</strong> header cells are matched after removing spaces and
 * underscores and ignoring case, and common aliases are accepted ({@code ID},
 * {@code Account}, {@code Company}, {@code Amount}, {@code Value}, {@code Notes},
 * {@code Zip}, ...). Blank rows are skipped. A missing AccountName reads as
 * {@code "Unknown"} and a missing DealName as {@code "Unnamed Deal"}. Rows are returned
 * raw; the repository normalizes them.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class DealTableMapper {

    public static final String DEFAULT_ACCOUNT_NAME = "Unknown";
    public static final String DEFAULT_DEAL_NAME = "Unnamed Deal";

    /**
     * Columns that must be present for a Deals table to be usable.
     */
    public static final List<String> REQUIRED_COLUMNS = List.of("DealId", "AccountName", "DealName", "Stage");

    static final List<Column> COLUMNS = List.of(
        text("DealId", Deal::getDealId, Deal::setDealId, "ID"),
        text("OrderNo", Deal::getOrderNo, Deal::setOrderNo, "OrderNumber"),
        text("UserId", Deal::getUserId, Deal::setUserId),
        text("AccountName", Deal::getAccountName, Deal::setAccountName, "Account", "Company"),
        text("ContactName", Deal::getContactName, Deal::setContactName, "Contact"),
        text("Email", Deal::getEmail, Deal::setEmail, "E-mail"),
        text("Phone", Deal::getPhone, Deal::setPhone, "Telephone", "Tel"),
        text("Postcode", Deal::getPostcode, Deal::setPostcode, "PostCode", "Zip"),
        text("PostcodeArea", Deal::getPostcodeArea, Deal::setPostcodeArea),
        text("InstallationLocation", Deal::getInstallationLocation, Deal::setInstallationLocation, "Address"),
        text("Region", Deal::getRegion, Deal::setRegion),
        text("MapLink", Deal::getMapLink, Deal::setMapLink, "Map"),
        text("LeadSource", Deal::getLeadSource, Deal::setLeadSource, "Source"),
        text("ProductLine", Deal::getProductLine, Deal::setProductLine, "Product"),
        text("DealName", Deal::getDealName, Deal::setDealName, "Deal", "Opportunity"),
        new Column("Stage", d -> d.getStage().getDisplayName(),
            (d, v) -> d.setStage(DealStage.parse(v))),
        new Column("Probability", d -> String.valueOf(d.getProbability()),
            (d, v) -> d.setProbability(FieldParsers.parseProbability(v)), "Prob"),
        money("AmountGBP", Deal::getAmountGbp, Deal::setAmountGbp, "Amount", "Value"),
        new Column("WeightedAmountGBP", d -> decimalText(d.getWeightedAmountGbp()), null),
        text("Owner", Deal::getOwner, Deal::setOwner, "SalesRep", "Rep"),
        date("CreatedDate", Deal::getCreatedDate, Deal::setCreatedDate, "Created"),
        date("LastContactedDate", Deal::getLastContactedDate, Deal::setLastContactedDate, "LastContact"),
        text("NextStep", Deal::getNextStep, Deal::setNextStep),
        date("NextStepDueDate", Deal::getNextStepDueDate, Deal::setNextStepDueDate, "NextStepDue"),
        date("CloseDate", Deal::getCloseDate, Deal::setCloseDate, "ExpectedClose"),
        text("ServicePlan", Deal::getServicePlan, Deal::setServicePlan),
        date("LastServiceDate", Deal::getLastServiceDate, Deal::setLastServiceDate),
        date("NextServiceDueDate", Deal::getNextServiceDueDate, Deal::setNextServiceDueDate),
        text("Comments", Deal::getComments, Deal::setComments, "Notes"),
        new Column("Tags", d -> String.join(", ", d.getTags()),
            (d, v) -> d.setTags(FieldParsers.parseTags(v))),
        text("PromoterId", Deal::getPromoterId, Deal::setPromoterId),
        text("PromoCode", Deal::getPromoCode, Deal::setPromoCode),
        money("PromoterCommission", Deal::getPromoterCommission, Deal::setPromoterCommission, "Commission"),
        new Column("CommissionPaid", d -> d.isCommissionPaid() ? "Yes" : "No",
            (d, v) -> d.setCommissionPaid(FieldParsers.parseBoolean(v).orElse(false))),
        date("CommissionPaidDate", Deal::getCommissionPaidDate, Deal::setCommissionPaidDate)
    );

    /**
     * Builds a fresh Deals table.
     *
     * @param deals deals in storage order
     * @return table with header row plus one row per deal
     */
    public Table toTable(Collection<Deal> deals) {
        Table table = new Table(Workbook.DEALS);
        table.addRow(headerNames());
        for (Deal deal : deals) {
            List<String> row = new ArrayList<>(COLUMNS.size());
            for (Column column : COLUMNS) {
                row.add(column.writer.apply(deal));
            }
            table.addRow(row);
        }
        return table;
    }

    /**
     * Reads every non-blank data row.
     *
     * @param table a Deals table whose first row is the header
     * @return un-normalized deals in row order
     */
    public List<Deal> fromTable(Table table) {
        Map<String, Integer> headerIndex = indexHeader(table.header());
        List<Deal> deals = new ArrayList<>();
        for (int r = 1; r < table.rowCount(); r++) {
            if (isBlankRow(table.row(r))) {
                continue;
            }
            Deal deal = new Deal();
            for (Column column : COLUMNS) {
                if (column.reader == null) {
                    continue;
                }
                String value = column.find(table, r, headerIndex);
                if (value != null) {
                    column.reader.accept(deal, value);
                }
            }
            if (isBlank(deal.getAccountName())) {
                deal.setAccountName(DEFAULT_ACCOUNT_NAME);
            }
            if (isBlank(deal.getDealName())) {
                deal.setDealName(DEFAULT_DEAL_NAME);
            }
            deals.add(deal);
        }
        return deals;
    }

    /**
     * Header names normalized for matching ({@code "Deal Id"} → {@code "dealid"}).
     */
    public static String normalizeHeader(String header) {
        return header.trim().replace(" ", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    public static Map<String, Integer> indexHeader(List<String> header) {
        Map<String, Integer> index = new HashMap<>();
        for (int c = 0; c < header.size(); c++) {
            String name = header.get(c);
            if (!isBlank(name)) {
                index.putIfAbsent(normalizeHeader(name), c);
            }
        }
        return index;
    }

    public static List<String> headerNames() {
        List<String> names = new ArrayList<>(COLUMNS.size());
        for (Column column : COLUMNS) {
            names.add(column.name);
        }
        return names;
    }

    /**
     * Whether the header contains the column or one of its aliases.
     *
     * @param headerIndex result of {@link #indexHeader(List)}
     * @param columnName canonical column name
     */
    public static boolean hasColumn(Map<String, Integer> headerIndex, String columnName) {
        String key = normalizeHeader(columnName);
        for (Column column : COLUMNS) {
            if (column.matchKeys.get(0).equals(key)) {
                return column.matchKeys.stream().anyMatch(headerIndex::containsKey);
            }
        }
        return headerIndex.containsKey(key);
    }

    private static boolean isBlankRow(List<String> row) {
        for (String cell : row) {
            if (!isBlank(cell)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String decimalText(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static Column text(String name, Function<Deal, String> getter, BiConsumer<Deal, String> setter,
                               String... aliases) {
        return new Column(name, d -> getter.apply(d) == null ? "" : getter.apply(d), setter, aliases);
    }

    private static Column money(String name, Function<Deal, BigDecimal> getter,
                                BiConsumer<Deal, BigDecimal> setter, String... aliases) {
        return new Column(name, d -> decimalText(getter.apply(d)),
            (d, v) -> setter.accept(d, FieldParsers.parseAmount(v).orElse(null)), aliases);
    }

    private static Column date(String name, Function<Deal, LocalDate> getter,
                               BiConsumer<Deal, LocalDate> setter, String... aliases) {
        return new Column(name, d -> getter.apply(d) == null ? "" : getter.apply(d).toString(),
            (d, v) -> setter.accept(d, FieldParsers.parseDate(v).orElse(null)), aliases);
    }

    /**
     * One column: canonical name, accepted aliases and its two conversions.
     * A null reader marks a write-only column.
     */
    static final class Column {

        final String name;
        final List<String> matchKeys;
        final Function<Deal, String> writer;
        final BiConsumer<Deal, String> reader;

        Column(String name, Function<Deal, String> writer, BiConsumer<Deal, String> reader, String... aliases) {
            this.name = name;
            this.writer = writer;
            this.reader = reader;
            List<String> keys = new ArrayList<>();
            keys.add(normalizeHeader(name));
            for (String alias : aliases) {
                keys.add(normalizeHeader(alias));
            }
            this.matchKeys = List.copyOf(keys);
        }

        /**
         * @return trimmed cell text under the first matching header that is not blank, or null
         */
        String find(Table table, int row, Map<String, Integer> headerIndex) {
            for (String key : matchKeys) {
                Integer column = headerIndex.get(key);
                if (column != null) {
                    String value = table.cell(row, column).trim();
                    if (!value.isEmpty()) {
                        return value;
                    }
                }
            }
            return null;
        }
    }
}
