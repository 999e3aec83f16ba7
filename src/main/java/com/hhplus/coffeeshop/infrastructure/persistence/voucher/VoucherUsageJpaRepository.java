package com.hhplus.coffeeshop.infrastructure.persistence.voucher;

import com.hhplus.coffeeshop.domain.voucher.VoucherUsage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface VoucherUsageJpaRepository extends JpaRepository<VoucherUsage, Long> {

    Optional<VoucherUsage> findByUserIdAndVoucherId(Long userId, Long voucherId);

    List<VoucherUsage> findByUserId(Long userId);
}
