package com.hhplus.coffeeshop.infrastructure.persistence.voucher;

import com.hhplus.coffeeshop.domain.voucher.Voucher;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Voucher JPA Repository
 */
public interface VoucherJpaRepository extends JpaRepository<Voucher, Long> {

    Optional<Voucher> findByCode(String code);

    /**
     * 코드로 조회 (비관적 락 - 사용 횟수 증가 직렬화)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT v FROM Voucher v WHERE v.code = :code")
    Optional<Voucher> findByCodeWithLock(@Param("code") String code);

    /**
     * 현재 시점에 사용 가능한 활성 바우처 조회
     */
    @Query("SELECT v FROM Voucher v WHERE v.isActive = true " +
            "AND (v.startsAt IS NULL OR v.startsAt <= :now) " +
            "AND (v.endsAt IS NULL OR v.endsAt >= :now) " +
            "ORDER BY v.voucherId ASC")
    List<Voucher> findUsableAt(@Param("now") LocalDateTime now);
}
