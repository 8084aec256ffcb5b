package com.ryuqq.dealstore.adapter.file;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.adapter.file.table.WorkbookCodec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hand-built workbooks in each historical on-disk layout.
 */
final class TestWorkbooks {

    static final String[] V10_HEADER = {
        "DealId", "AccountName", "ContactName", "Postcode", "DealName", "Stage", "Probability",
        "AmountGBP", "Owner", "CreatedDate", "Tags"
    };

    private TestWorkbooks() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * 1.0: Deals and Lookups only, no Metadata table, no promoter columns.
     */
    static Workbook v10(String[]... rows) {
        Workbook workbook = new Workbook();
        Table deals = workbook.addTable(Workbook.DEALS);
        deals.addRow(V10_HEADER);
        for (String[] row : rows) {
            deals.addRow(row);
        }
        Table lookups = workbook.addTable(Workbook.LOOKUPS);
        lookups.addRow("PostcodeArea", "Region", "", "Stage", "DefaultProbability");
        lookups.addRow("SW", "London", "", "Proposal", "55");
        return workbook;
    }

    /**
     * 1.1: 1.0 plus a Metadata table with Version=1.1.
     */
    static Workbook v11(String[]... rows) {
        Workbook workbook = v10(rows);
        Table metadata = workbook.addTable(Workbook.METADATA);
        metadata.addRow("Property", "Value");
        metadata.addRow("Version", "1.1");
        return workbook;
    }

    static Workbook withVersion(String version, String[]... rows) {
        Workbook workbook = v11(rows);
        workbook.table(Workbook.METADATA).orElseThrow().setCell(1, 1, version);
        return workbook;
    }

    static String[] row(String id, String account, String dealName, String stage) {
        return new String[] {id, account, "", "SW1A 1AA", dealName, stage, "", "5000", "Alice", "2025-01-02", "solar"};
    }

    static Path write(Workbook workbook, Path path) throws IOException {
        new WorkbookCodec().write(workbook, path);
        return path;
    }
}
