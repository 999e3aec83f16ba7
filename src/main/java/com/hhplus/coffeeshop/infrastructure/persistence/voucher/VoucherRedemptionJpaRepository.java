package com.hhplus.coffeeshop.infrastructure.persistence.voucher;

import com.hhplus.coffeeshop.domain.voucher.VoucherRedemption;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VoucherRedemptionJpaRepository extends JpaRepository<VoucherRedemption, Long> {

    List<VoucherRedemption> findByVoucherIdOrderByUsedAtDesc(Long voucherId);
}
