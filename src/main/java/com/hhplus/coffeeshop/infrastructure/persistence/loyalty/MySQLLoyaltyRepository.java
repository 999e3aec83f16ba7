package com.hhplus.coffeeshop.infrastructure.persistence.loyalty;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyCreditFailure;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyRepository;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransaction;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransactionType;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * MySQL 기반 Loyalty Repository 구현
 *
 * 포인트 원장(loyalty_transactions)과 적립 실패 기록(loyalty_credit_failures)을 다룹니다.
 */
@Repository
@Primary
@Transactional
public class MySQLLoyaltyRepository implements LoyaltyRepository {

    private final LoyaltyTransactionJpaRepository transactionJpaRepository;
    private final LoyaltyCreditFailureJpaRepository failureJpaRepository;

    public MySQLLoyaltyRepository(LoyaltyTransactionJpaRepository transactionJpaRepository,
                                  LoyaltyCreditFailureJpaRepository failureJpaRepository) {
        this.transactionJpaRepository = transactionJpaRepository;
        this.failureJpaRepository = failureJpaRepository;
    }

    @Override
    public LoyaltyTransaction saveTransaction(LoyaltyTransaction transaction) {
        return transactionJpaRepository.save(transaction);
    }

    @Override
    public List<LoyaltyTransaction> findTransactionsByUserId(Long userId) {
        return transactionJpaRepository.findByUserIdOrderByCreatedAtDescLoyaltyTransactionIdDesc(userId);
    }

    @Override
    public long sumDeltaByUserId(Long userId) {
        Long sum = transactionJpaRepository.sumDeltaByUserId(userId);
        return sum != null ? sum : 0L;
    }

    @Override
    public boolean existsEarnForOrder(Long orderId) {
        return transactionJpaRepository.existsByOrderIdAndType(orderId, LoyaltyTransactionType.EARN);
    }

    @Override
    public LoyaltyCreditFailure saveFailure(LoyaltyCreditFailure failure) {
        return failureJpaRepository.save(failure);
    }

    @Override
    public List<LoyaltyCreditFailure> findUnresolvedFailures() {
        return failureJpaRepository.findByResolvedFalseOrderByCreatedAtAsc();
    }
}
