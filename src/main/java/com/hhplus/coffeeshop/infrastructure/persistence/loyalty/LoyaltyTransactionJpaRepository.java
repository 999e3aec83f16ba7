package com.hhplus.coffeeshop.infrastructure.persistence.loyalty;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransaction;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * LoyaltyTransaction JPA Repository (포인트 원장)
 */
public interface LoyaltyTransactionJpaRepository extends JpaRepository<LoyaltyTransaction, Long> {

    List<LoyaltyTransaction> findByUserIdOrderByCreatedAtDescLoyaltyTransactionIdDesc(Long userId);

    @Query("SELECT COALESCE(SUM(t.delta), 0) FROM LoyaltyTransaction t WHERE t.userId = :userId")
    Long sumDeltaByUserId(@Param("userId") Long userId);

    boolean existsByOrderIdAndType(Long orderId, LoyaltyTransactionType type);
}
