package com.hhplus.coffeeshop.infrastructure.persistence.voucher;

import com.hhplus.coffeeshop.domain.voucher.Voucher;
import com.hhplus.coffeeshop.domain.voucher.VoucherRedemption;
import com.hhplus.coffeeshop.domain.voucher.VoucherRepository;
import com.hhplus.coffeeshop.domain.voucher.VoucherUsage;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Voucher Repository 구현
 *
 * 바우처 본체, 사용자별 사용 횟수(voucher_usage), 사용 이력(voucher_redemptions)을 함께 다룹니다.
 */
@Repository
@Primary
@Transactional
public class MySQLVoucherRepository implements VoucherRepository {

    private final VoucherJpaRepository voucherJpaRepository;
    private final VoucherUsageJpaRepository usageJpaRepository;
    private final VoucherRedemptionJpaRepository redemptionJpaRepository;

    public MySQLVoucherRepository(VoucherJpaRepository voucherJpaRepository,
                                  VoucherUsageJpaRepository usageJpaRepository,
                                  VoucherRedemptionJpaRepository redemptionJpaRepository) {
        this.voucherJpaRepository = voucherJpaRepository;
        this.usageJpaRepository = usageJpaRepository;
        this.redemptionJpaRepository = redemptionJpaRepository;
    }

    @Override
    public Optional<Voucher> findByCode(String normalizedCode) {
        return voucherJpaRepository.findByCode(normalizedCode);
    }

    @Override
    public Optional<Voucher> findByCodeForUpdate(String normalizedCode) {
        return voucherJpaRepository.findByCodeWithLock(normalizedCode);
    }

    @Override
    public Optional<Voucher> findById(Long voucherId) {
        return voucherJpaRepository.findById(voucherId);
    }

    @Override
    public Voucher save(Voucher voucher) {
        return voucherJpaRepository.save(voucher);
    }

    @Override
    public List<Voucher> findUsableAt(LocalDateTime now) {
        return voucherJpaRepository.findUsableAt(now);
    }

    @Override
    public Optional<VoucherUsage> findUsage(Long userId, Long voucherId) {
        return usageJpaRepository.findByUserIdAndVoucherId(userId, voucherId);
    }

    @Override
    public List<VoucherUsage> findUsagesByUserId(Long userId) {
        return usageJpaRepository.findByUserId(userId);
    }

    @Override
    public VoucherUsage saveUsage(VoucherUsage usage) {
        return usageJpaRepository.save(usage);
    }

    @Override
    public VoucherRedemption saveRedemption(VoucherRedemption redemption) {
        return redemptionJpaRepository.save(redemption);
    }

    @Override
    public List<VoucherRedemption> findRedemptionsByVoucherId(Long voucherId) {
        return redemptionJpaRepository.findByVoucherIdOrderByUsedAtDesc(voucherId);
    }
}
