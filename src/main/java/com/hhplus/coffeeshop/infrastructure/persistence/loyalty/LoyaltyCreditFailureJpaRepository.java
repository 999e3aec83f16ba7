package com.hhplus.coffeeshop.infrastructure.persistence.loyalty;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyCreditFailure;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LoyaltyCreditFailureJpaRepository extends JpaRepository<LoyaltyCreditFailure, Long> {

    List<LoyaltyCreditFailure> findByResolvedFalseOrderByCreatedAtAsc();
}
