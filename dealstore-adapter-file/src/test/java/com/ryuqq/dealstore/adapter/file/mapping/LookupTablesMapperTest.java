package com.ryuqq.dealstore.adapter.file.mapping;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.DealStage;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LookupTablesMapperTest {

    private final LookupTablesMapper mapper = new LookupTablesMapper();

    @Test
    void toTable_thenFromTable_keepsCustomEntries() {
        LookupTables lookups = LookupTables.createDefault();
        lookups.putRegion("ZZ", "Nowhere");
        lookups.putProbability(DealStage.DISCOVERY, 35);

        LookupTables read = mapper.fromTable(Optional.of(mapper.toTable(lookups)));

        assertThat(read.regionForArea("zz")).isEqualTo("Nowhere");
        assertThat(read.probabilityForStage(DealStage.DISCOVERY)).isEqualTo(35);
        assertThat(read.areaToRegion()).isEqualTo(lookups.areaToRegion());
    }

    @Test
    void fromTable_skipsMalformedRows() {
        Table table = new Table(Workbook.LOOKUPS);
        table.addRow("PostcodeArea", "Region", "", "Stage", "DefaultProbability");
        table.addRow("", "Orphan region", "", "Unheard-of", "50");
        table.addRow("SW", "", "", "Lead", "lots");
        table.addRow("EX", "Devon", "", "Qualified", "25");

        LookupTables read = mapper.fromTable(Optional.of(table));

        assertThat(read.regionForArea("SW")).isEqualTo("London");
        assertThat(read.regionForArea("EX")).isEqualTo("Devon");
        assertThat(read.probabilityForStage(DealStage.LEAD)).isEqualTo(10);
        assertThat(read.probabilityForStage(DealStage.QUALIFIED)).isEqualTo(25);
    }

    @Test
    void absentTable_yieldsDefaults() {
        assertThat(mapper.fromTable(Optional.empty()).probabilityForStage(DealStage.NEGOTIATION)).isEqualTo(80);
    }
}
