package com.ryuqq.dealstore.adapter.file.validation;

import com.ryuqq.dealstore.adapter.file.mapping.DealTableMapper;
import com.ryuqq.dealstore.adapter.file.schema.SchemaMigrator;
import com.ryuqq.dealstore.adapter.file.schema.WorkbookMetadata;
import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.adapter.file.table.WorkbookCodec;
import com.ryuqq.dealstore.adapter.file.table.WorkbookFormatException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that a durable file is structurally loadable before any state is touched.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>읽을 수 없는 파일 → invalid</li>
 *   <li>Deals 테이블 없음 / 필수 컬럼(DealId, AccountName, DealName, Stage) 없음 → invalid</li>
 *   <li>Lookups 테이블 없음 → warning (기본 lookup 사용)</li>
 *   <li>Metadata 테이블 없음 → warning, 버전 1.0으로 간주</li>
 *   <li>지원 목록 밖의 버전 → invalid, supportedVersion=false</li>
 * </ul>
 *
 * <p>Column names are matched the same way the mapper reads them, ignoring case, spaces
 * and underscores and accepting the mapper's aliases.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class WorkbookValidator {

    public static final String LEGACY_VERSION = "1.0";

    private final WorkbookCodec codec;
    private final SchemaMigrator migrator;

    public WorkbookValidator(WorkbookCodec codec, SchemaMigrator migrator) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (migrator == null) {
            throw new IllegalArgumentException("migrator cannot be null");
        }
        this.codec = codec;
        this.migrator = migrator;
    }

    /**
     * Reads and checks the file at {@code path}.
     *
     * @param path durable or temporary file
     * @return result; never throws for malformed content
     */
    public ValidationResult validate(Path path) {
        if (!Files.exists(path)) {
            return ValidationResult.unreadable("File not found: " + path);
        }
        Workbook workbook;
        try {
            workbook = codec.read(path);
        } catch (IOException | WorkbookFormatException e) {
            return ValidationResult.unreadable("Cannot read file: " + e.getMessage());
        }
        return validate(workbook);
    }

    /**
     * Checks an already decoded workbook.
     */
    public ValidationResult validate(Workbook workbook) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Optional<Table> deals = workbook.table(Workbook.DEALS);
        int dealCount = 0;
        if (deals.isEmpty()) {
            errors.add("Missing required table: " + Workbook.DEALS);
        } else {
            Table table = deals.get();
            if (table.rowCount() == 0) {
                errors.add("Deals table has no header row");
            } else {
                Map<String, Integer> header = DealTableMapper.indexHeader(table.header());
                for (String column : DealTableMapper.REQUIRED_COLUMNS) {
                    if (!DealTableMapper.hasColumn(header, column)) {
                        errors.add("Missing required column: " + column);
                    }
                }
                dealCount = table.rowCount() - 1;
            }
        }

        boolean hasLookups = workbook.hasTable(Workbook.LOOKUPS);
        if (!hasLookups) {
            warnings.add("Missing Lookups table; default lookups will be used");
        }

        boolean hasMetadata = workbook.hasTable(Workbook.METADATA);
        String version = LEGACY_VERSION;
        if (!hasMetadata) {
            warnings.add("Missing Metadata table; assuming schema version " + LEGACY_VERSION);
        } else {
            Optional<String> recorded = WorkbookMetadata.property(workbook, WorkbookMetadata.VERSION);
            if (recorded.isPresent() && !recorded.get().isEmpty()) {
                version = recorded.get();
            }
        }

        boolean supported = migrator.isSupported(version);
        if (!supported) {
            errors.add("Unsupported schema version: " + version
                + ". Supported versions: " + String.join(", ", migrator.supportedVersions()));
        }
        boolean requiresMigration = supported && migrator.requiresMigration(version);

        return new ValidationResult(errors.isEmpty(), errors, warnings, dealCount,
            deals.isPresent(), hasLookups, hasMetadata, version, requiresMigration, supported);
    }
}
