package com.ryuqq.dealstore.core.normalize;

import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.Deal;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Fills in derived and defaulted fields and reports exactly what it changed.
 *
 * <p>Runs on every create, update and load. The input deal is never modified; the result
 * carries a normalized copy.</p>
 *
 * <p><strong>Rules (in order):</strong></p>
 * <ol>
 *   <li>Empty dealId → generated by the context's id generator</li>
 *   <li>Probability ≤ 0 → stage default from the lookup tables</li>
 *   <li>Postcode set → postcodeArea extracted; region looked up when unset</li>
 *   <li>Postcode set and mapLink blank → Google Maps search link</li>
 *   <li>createdDate unset → context's today</li>
 *   <li>Tags trimmed, blanks dropped, case-insensitive duplicates removed</li>
 * </ol>
 *
 * <p><strong>Change Tracking:</strong> a {@link NormalizationChange} is recorded only when
 * a value actually differs, so normalizing an already-normalized deal reports nothing.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class DealNormalizer {

    static final String MAP_SEARCH_URL = "https://www.google.com/maps/search/?api=1&query=";

    private final LookupTables lookups;
    private final SystemContext context;

    public DealNormalizer(LookupTables lookups, SystemContext context) {
        if (lookups == null) {
            throw new IllegalArgumentException("lookups cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.lookups = lookups;
        this.context = context;
    }

    /**
     * Normalizes without returning the change list.
     *
     * @param deal deal to normalize
     * @return normalized copy
     */
    public Deal normalize(Deal deal) {
        return normalizeWithTracking(deal).deal();
    }

    /**
     * Normalizes a copy of the deal and records every change.
     *
     * @param deal deal to normalize (not modified)
     * @return normalized copy plus changes
     * @throws IllegalArgumentException if deal is null
     */
    public NormalizationResult normalizeWithTracking(Deal deal) {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        Deal d = deal.copy();
        List<NormalizationChange> changes = new ArrayList<>();

        if (d.getDealId().isEmpty()) {
            String id = context.idGenerator().generate();
            changes.add(new NormalizationChange("DealId", null, id, "Auto-generated missing DealId"));
            d.setDealId(id);
        }

        if (d.getProbability() <= 0) {
            int probability = lookups.probabilityForStage(d.getStage());
            if (probability != d.getProbability()) {
                changes.add(new NormalizationChange("Probability",
                    String.valueOf(d.getProbability()), String.valueOf(probability),
                    "Set default probability for stage " + d.getStage().getDisplayName()));
                d.setProbability(probability);
            }
        }

        if (!FieldParsers.isBlank(d.getPostcode())) {
            // no leading letters: no area, stored as null so an empty cell reads back unchanged
            String extracted = LookupTables.extractPostcodeArea(d.getPostcode());
            String area = extracted.isEmpty() ? null : extracted;
            if (!Objects.equals(area, d.getPostcodeArea())) {
                changes.add(new NormalizationChange("PostcodeArea", d.getPostcodeArea(), area,
                    "Extracted from postcode " + d.getPostcode()));
                d.setPostcodeArea(area);
            }
            if (area != null && d.getRegion() == null) {
                String region = lookups.regionForArea(area);
                if (region != null) {
                    changes.add(new NormalizationChange("Region", null, region,
                        "Derived from postcode area " + area));
                    d.setRegion(region);
                }
            }
            if (FieldParsers.isBlank(d.getMapLink())) {
                String link = mapLink(d.getInstallationLocation(), d.getPostcode());
                changes.add(new NormalizationChange("MapLink", d.getMapLink(), link,
                    "Generated Google Maps link from address"));
                d.setMapLink(link);
            }
        }

        if (d.getCreatedDate() == null) {
            LocalDate today = context.today();
            changes.add(new NormalizationChange("CreatedDate", null, today.toString(),
                "Set default creation date"));
            d.setCreatedDate(today);
        }

        List<String> cleaned = cleanTags(d.getTags());
        if (!cleaned.equals(d.getTags())) {
            changes.add(new NormalizationChange("Tags", String.join(", ", d.getTags()),
                String.join(", ", cleaned), "Cleaned and deduplicated tags"));
            d.setTags(cleaned);
        }

        return new NormalizationResult(d, changes);
    }

    /**
     * Builds the map search link for an address.
     *
     * @param installationLocation street address, may be blank
     * @param postcode postcode, not blank
     * @return search URL with the address percent-escaped
     */
    public static String mapLink(String installationLocation, String postcode) {
        Objects.requireNonNull(postcode, "postcode");
        String address = FieldParsers.isBlank(installationLocation)
            ? postcode
            : installationLocation + ", " + postcode;
        return MAP_SEARCH_URL + FieldParsers.escapeQuery(address);
    }

    private static List<String> cleanTags(List<String> tags) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String tag : tags) {
            if (FieldParsers.isBlank(tag)) {
                continue;
            }
            String trimmed = tag.trim();
            unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return new ArrayList<>(unique.values());
    }

    public LookupTables lookups() {
        return lookups;
    }

    public SystemContext context() {
        return context;
    }
}
