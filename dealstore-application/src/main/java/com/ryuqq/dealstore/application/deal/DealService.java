package com.ryuqq.dealstore.application.deal;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;
import com.ryuqq.dealstore.core.normalize.NormalizationResult;
import com.ryuqq.dealstore.core.patch.PatchResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deal CRUD use cases (RPC/콘솔 호출자가 사용하는 서비스 계층).
 *
 * <p>모든 쓰기 작업은 normalize → upsert → saveChanges 순서로 진행되며,
 * 메서드가 정상 반환되면 변경은 이미 커밋된 상태입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PatchResult result = dealService.patch("D-20250315-00000001",
 *     Map.of("Owner", "Alice", "Probability", 150));
 *
 * if (!result.success()) {
 *     // "Partial success: 1 field(s) rejected"
 *     result.rejectedFields().forEach(r -&gt; log.warn("{}: {}", r.field(), r.reason()));
 * }
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public interface DealService {

    /**
     * @return every deal in storage order
     */
    List<Deal> list();

    /**
     * Deals matching the filter, with relative predicates evaluated against today's date
     * from the service's context.
     *
     * @param filter predicates
     * @return matching deals
     */
    List<Deal> search(DealFilter filter);

    Optional<Deal> get(String dealId);

    /**
     * Normalizes, stores and commits one deal. A blank id gets a generated one.
     *
     * @param deal deal to create or replace
     * @return the stored deal and the derived-field changes
     */
    NormalizationResult upsert(Deal deal);

    /**
     * Normalizes and stores every deal, then commits once.
     *
     * @param deals deals to import
     * @return one result per input deal, in input order
     */
    List<NormalizationResult> importDeals(Collection<Deal> deals);

    /**
     * Applies a partial update through the patch whitelist.
     *
     * <p><strong>결과:</strong></p>
     * <ul>
     *   <li>deal 없음 → {@link PatchResult#notFound}, 저장 없음</li>
     *   <li>적용된 필드 없음 + 거부된 필드 있음 → {@link PatchResult#validationFailed}, 저장 없음</li>
     *   <li>그 외 → normalize 후 커밋, 거부된 필드가 있으면 success=false</li>
     * </ul>
     *
     * @param dealId deal key (case-insensitive)
     * @param fields field name → new value
     * @return patch outcome; field errors are reported here, never thrown
     */
    PatchResult patch(String dealId, Map<String, ?> fields);

    /**
     * Deletes and commits.
     *
     * @return true if the deal existed
     */
    boolean delete(String dealId);
}
