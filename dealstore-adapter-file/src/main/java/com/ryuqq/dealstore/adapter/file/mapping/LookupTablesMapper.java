package com.ryuqq.dealstore.adapter.file.mapping;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.DealStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps {@link LookupTables} to and from the {@code Lookups} table.
 *
 * <p>The table holds two independent blocks side by side:</p>
 * <pre>
 *   A             B        C   D                 E
 *   PostcodeArea  Region       Stage             DefaultProbability
 *   AB            Scotland     Lead              10
 *   AL            East of...   Qualified         20
 *   ...
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class LookupTablesMapper {

    private static final int AREA = 0;
    private static final int REGION = 1;
    private static final int STAGE = 3;
    private static final int PROBABILITY = 4;

    public Table toTable(LookupTables lookups) {
        Table table = new Table(Workbook.LOOKUPS);
        table.addRow("PostcodeArea", "Region", "", "Stage", "DefaultProbability");

        List<Map.Entry<String, String>> regions = new ArrayList<>(new TreeMap<>(lookups.areaToRegion()).entrySet());
        List<Map.Entry<DealStage, Integer>> stages = new ArrayList<>(lookups.stageProbabilities().entrySet());
        int rows = Math.max(regions.size(), stages.size());
        for (int i = 0; i < rows; i++) {
            String[] row = {"", "", "", "", ""};
            if (i < regions.size()) {
                row[AREA] = regions.get(i).getKey();
                row[REGION] = regions.get(i).getValue();
            }
            if (i < stages.size()) {
                row[STAGE] = stages.get(i).getKey().getDisplayName();
                row[PROBABILITY] = String.valueOf(stages.get(i).getValue());
            }
            table.addRow(row);
        }
        return table;
    }

    /**
     * Reads the Lookups table over the defaults: entries found in the table replace the
     * default for that area or stage, everything else keeps its default. Malformed rows
     * are skipped.
     *
     * @param table Lookups table, or empty to get the defaults
     * @return lookup tables
     */
    public LookupTables fromTable(Optional<Table> table) {
        LookupTables lookups = LookupTables.createDefault();
        if (table.isEmpty()) {
            return lookups;
        }
        Table t = table.get();
        for (int r = 1; r < t.rowCount(); r++) {
            String area = t.cell(r, AREA).trim();
            String region = t.cell(r, REGION).trim();
            if (!area.isEmpty() && !region.isEmpty()) {
                lookups.putRegion(area, region);
            }

            Optional<DealStage> stage = DealStage.tryParse(t.cell(r, STAGE).trim());
            Optional<Integer> probability = parseProbability(t.cell(r, PROBABILITY));
            if (stage.isPresent() && probability.isPresent()) {
                lookups.putProbability(stage.get(), probability.get());
            }
        }
        return lookups;
    }

    private static Optional<Integer> parseProbability(String text) {
        try {
            int value = Integer.parseInt(text.trim());
            return value >= 0 && value <= 100 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
