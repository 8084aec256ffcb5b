package com.ryuqq.dealstore.adapter.file.schema;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;

/**
 * 1.0 → 1.1: 1.0 파일에는 버전 정보가 없으므로 Metadata 테이블과 Version 행을 추가합니다.
 *
 * <p>Metadata 테이블이 이미 있으면 기존 행은 그대로 두고 Version만 1.1로 설정합니다.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class MigrateV10ToV11 implements SchemaMigration {

    @Override
    public String fromVersion() {
        return "1.0";
    }

    @Override
    public String toVersion() {
        return "1.1";
    }

    @Override
    public void apply(Workbook workbook) {
        Table metadata = WorkbookMetadata.ensureTable(workbook);
        WorkbookMetadata.setProperty(metadata, WorkbookMetadata.VERSION, toVersion());
    }
}
