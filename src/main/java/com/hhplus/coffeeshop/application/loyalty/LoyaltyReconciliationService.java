package com.hhplus.coffeeshop.application.loyalty;

import com.hhplus.coffeeshop.application.loyalty.dto.ReconciliationResult;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyCreditFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 포인트 적립 실패 재처리
 *
 * loyalty_credit_failures의 미해결 건을 하나씩 다시 적립합니다.
 * 적립은 주문 단위로 멱등이므로 이미 적립된 주문은 해결 처리만 됩니다.
 * 건별로 독립된 트랜잭션에서 실행되며, 실패한 건은 미해결로 남습니다.
 */
@Slf4j
@Service
public class LoyaltyReconciliationService {

    private final LoyaltyService loyaltyService;

    public LoyaltyReconciliationService(LoyaltyService loyaltyService) {
        this.loyaltyService = loyaltyService;
    }

    public ReconciliationResult retryFailedCredits() {
        List<LoyaltyCreditFailure> failures = loyaltyService.unresolvedFailures();
        int resolved = 0;

        for (LoyaltyCreditFailure failure : failures) {
            try {
                loyaltyService.creditForOrder(
                        failure.getUserId(), failure.getOrderId(), failure.getOrderNumber(), failure.getTotalAmount());
                loyaltyService.markFailureResolved(failure);
                resolved++;
            } catch (RuntimeException e) {
                log.error("[LoyaltyReconciliationService] 재처리 실패 - failureId={}, orderId={}",
                        failure.getLoyaltyCreditFailureId(), failure.getOrderId(), e);
            }
        }

        log.info("[LoyaltyReconciliationService] 재처리 완료 - attempted={}, resolved={}", failures.size(), resolved);
        return new ReconciliationResult(failures.size(), resolved, failures.size() - resolved);
    }
}
