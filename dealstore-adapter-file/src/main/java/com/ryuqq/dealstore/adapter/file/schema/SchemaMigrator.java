package com.ryuqq.dealstore.adapter.file.schema;

import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.core.exception.UnsupportedSchemaVersionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema version state machine: walks a workbook from its on-disk version to the current one.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <pre>
 * 1.0 ──MigrateV10ToV11──▶ 1.1 ──MigrateV11ToV12──▶ 1.2 (current)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>지원 목록에 없는 버전은 어떤 변경도 하기 전에 거부 ({@link UnsupportedSchemaVersionException})</li>
 *   <li>현재 버전에서 시작하면 아무 것도 하지 않음</li>
 *   <li>각 단계는 정확히 한 번, 순서대로 적용</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class SchemaMigrator {

    private final String currentVersion;
    private final List<String> supportedVersions;
    private final Map<String, SchemaMigration> steps = new HashMap<>();

    public SchemaMigrator(String currentVersion, List<String> supportedVersions, List<SchemaMigration> migrations) {
        if (currentVersion == null || supportedVersions == null || migrations == null) {
            throw new IllegalArgumentException("currentVersion, supportedVersions and migrations cannot be null");
        }
        if (!supportedVersions.contains(currentVersion)) {
            throw new IllegalArgumentException(
                "currentVersion must be supported (current: " + currentVersion + ", supported: " + supportedVersions + ")"
            );
        }
        this.currentVersion = currentVersion;
        this.supportedVersions = List.copyOf(supportedVersions);
        for (SchemaMigration migration : migrations) {
            if (steps.put(migration.fromVersion(), migration) != null) {
                throw new IllegalArgumentException("Duplicate migration from " + migration.fromVersion());
            }
        }
    }

    /**
     * The built-in chain: 1.0 → 1.1 → 1.2.
     */
    public static SchemaMigrator standard(String currentVersion, List<String> supportedVersions) {
        return new SchemaMigrator(currentVersion, supportedVersions,
            List.of(new MigrateV10ToV11(), new MigrateV11ToV12()));
    }

    public boolean isSupported(String version) {
        return supportedVersions.contains(version);
    }

    public boolean requiresMigration(String version) {
        return !currentVersion.equals(version);
    }

    /**
     * Plans the steps from {@code fromVersion} to the current version without applying them.
     *
     * @throws UnsupportedSchemaVersionException if fromVersion is not supported
     * @throws IllegalStateException if the chain has a gap
     */
    public List<SchemaMigration> plan(String fromVersion) {
        if (!isSupported(fromVersion)) {
            throw new UnsupportedSchemaVersionException(fromVersion, supportedVersions);
        }
        List<SchemaMigration> plan = new ArrayList<>();
        String version = fromVersion;
        while (!version.equals(currentVersion)) {
            SchemaMigration step = steps.get(version);
            if (step == null) {
                throw new IllegalStateException("No migration from schema version " + version);
            }
            plan.add(step);
            version = step.toVersion();
            if (plan.size() > steps.size()) {
                throw new IllegalStateException("Migration chain does not reach " + currentVersion);
            }
        }
        return plan;
    }

    /**
     * Migrates the workbook in place.
     *
     * @param workbook workbook at {@code fromVersion}
     * @param fromVersion detected on-disk version
     * @return the steps that were applied (empty when already current)
     * @throws UnsupportedSchemaVersionException if fromVersion is not supported
     */
    public List<SchemaMigration> migrate(Workbook workbook, String fromVersion) {
        List<SchemaMigration> plan = plan(fromVersion);
        for (SchemaMigration step : plan) {
            step.apply(workbook);
        }
        return plan;
    }

    public String currentVersion() {
        return currentVersion;
    }

    public List<String> supportedVersions() {
        return supportedVersions;
    }
}
