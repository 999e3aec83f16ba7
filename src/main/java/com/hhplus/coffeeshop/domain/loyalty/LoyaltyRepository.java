package com.hhplus.coffeeshop.domain.loyalty;

import java.util.List;

/**
 * 포인트 원장 저장소 포트
 */
public interface LoyaltyRepository {

    LoyaltyTransaction saveTransaction(LoyaltyTransaction transaction);

    /**
     * 사용자 원장 (최신순)
     */
    List<LoyaltyTransaction> findTransactionsByUserId(Long userId);

    long sumDeltaByUserId(Long userId);

    boolean existsEarnForOrder(Long orderId);

    LoyaltyCreditFailure saveFailure(LoyaltyCreditFailure failure);

    List<LoyaltyCreditFailure> findUnresolvedFailures();
}
