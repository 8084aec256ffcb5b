package com.ryuqq.dealstore.adapter.file.schema;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;

/**
 * 1.1 → 1.2: Version 값을 1.2로 올립니다.
 *
 * <p>1.2에서 추가된 promoter 컬럼(PromoterId, PromoCode, PromoterCommission, CommissionPaid,
 * CommissionPaidDate)은 읽을 때 없으면 빈 값으로 취급되고 다음 커밋에서 헤더에 추가되므로
 * Deals 테이블은 건드리지 않습니다.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class MigrateV11ToV12 implements SchemaMigration {

    @Override
    public String fromVersion() {
        return "1.1";
    }

    @Override
    public String toVersion() {
        return "1.2";
    }

    @Override
    public void apply(Workbook workbook) {
        Table metadata = WorkbookMetadata.ensureTable(workbook);
        WorkbookMetadata.setProperty(metadata, WorkbookMetadata.VERSION, toVersion());
    }
}
