package com.ryuqq.dealstore.core.lookup;

import com.ryuqq.dealstore.core.model.DealStage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reference data used by normalization: postcode area → region and stage → default probability.
 *
 * <p>Area keys are stored upper-case and looked up case-insensitively. The tables are
 * mutable so that a durable store can replace the defaults with the Lookups table it
 * finds on disk; the normalizer only reads them.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class LookupTables {

    private final Map<String, String> areaToRegion = new LinkedHashMap<>();
    private final Map<DealStage, Integer> stageProbabilities = new EnumMap<>(DealStage.class);

    /**
     * Empty tables. Every stage still falls back to its built-in default probability.
     */
    public LookupTables() {
    }

    /**
     * UK postcode areas grouped into the standard regions, plus each stage's default probability.
     *
     * @return new default tables
     */
    public static LookupTables createDefault() {
        LookupTables tables = new LookupTables();
        Map<String, List<String>> regions = new LinkedHashMap<>();
        regions.put("London", List.of("E", "EC", "N", "NW", "SE", "SW", "W", "WC"));
        regions.put("South East", List.of("BN", "CT", "GU", "ME", "OX", "PO", "RG", "RH", "SL", "SO", "TN"));
        regions.put("South West", List.of("BA", "BH", "BS", "DT", "EX", "GL", "PL", "SN", "SP", "TA", "TQ", "TR"));
        regions.put("East of England", List.of("AL", "CB", "CM", "CO", "EN", "HP", "IP", "LU", "NR", "PE", "SG", "SS", "WD"));
        regions.put("West Midlands", List.of("B", "CV", "DY", "HR", "ST", "TF", "WR", "WS", "WV"));
        regions.put("East Midlands", List.of("DE", "DN", "LE", "LN", "NG", "NN"));
        regions.put("Yorkshire", List.of("BD", "HD", "HG", "HU", "HX", "LS", "S", "WF", "YO"));
        regions.put("North West", List.of("BB", "BL", "CA", "CH", "CW", "FY", "L", "LA", "M", "OL", "PR", "SK", "WA", "WN"));
        regions.put("North East", List.of("DH", "DL", "NE", "SR", "TS"));
        regions.put("Wales", List.of("CF", "LD", "LL", "NP", "SA", "SY"));
        regions.put("Scotland", List.of("AB", "DD", "DG", "EH", "FK", "G", "HS", "IV", "KA", "KW", "KY", "ML", "PA", "PH", "TD", "ZE"));
        regions.put("Northern Ireland", List.of("BT"));

        regions.forEach((region, areas) -> areas.forEach(area -> tables.putRegion(area, region)));
        for (DealStage stage : DealStage.values()) {
            tables.putProbability(stage, stage.getDefaultProbability());
        }
        return tables;
    }

    /**
     * Leading letters of a UK postcode, e.g. {@code "sw1a 1aa"} → {@code "SW"}.
     *
     * @param postcode raw postcode, may be null
     * @return the area letters, empty if none
     */
    public static String extractPostcodeArea(String postcode) {
        if (postcode == null) {
            return "";
        }
        String clean = postcode.trim().toUpperCase(Locale.ROOT).replace(" ", "");
        int end = 0;
        while (end < clean.length() && Character.isLetter(clean.charAt(end))) {
            end++;
        }
        return clean.substring(0, end);
    }

    public void putRegion(String area, String region) {
        if (area == null || area.isBlank()) {
            throw new IllegalArgumentException("area cannot be blank");
        }
        areaToRegion.put(area.trim().toUpperCase(Locale.ROOT), region);
    }

    public void putProbability(DealStage stage, int probability) {
        if (probability < 0 || probability > 100) {
            throw new IllegalArgumentException(
                "probability must be between 0 and 100 (current: " + probability + ")"
            );
        }
        stageProbabilities.put(stage, probability);
    }

    /**
     * @param area postcode area, any case
     * @return region or null when the area is unknown
     */
    public String regionForArea(String area) {
        if (area == null || area.isBlank()) {
            return null;
        }
        return areaToRegion.get(area.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @param postcode full postcode
     * @return region of the postcode's area, or null
     */
    public String regionForPostcode(String postcode) {
        if (postcode == null || postcode.isBlank()) {
            return null;
        }
        return regionForArea(extractPostcodeArea(postcode));
    }

    public int probabilityForStage(DealStage stage) {
        Integer p = stageProbabilities.get(stage);
        return p != null ? p : stage.getDefaultProbability();
    }

    public Map<String, String> areaToRegion() {
        return Collections.unmodifiableMap(areaToRegion);
    }

    public Map<DealStage, Integer> stageProbabilities() {
        return Collections.unmodifiableMap(stageProbabilities);
    }
}
