package com.hhplus.coffeeshop.domain.user;

import java.util.Optional;

/**
 * 사용자 저장소 포트
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    /**
     * 비관적 락으로 조회 (포인트 잔액 변경용)
     */
    Optional<User> findByIdForUpdate(Long userId);

    boolean existsById(Long userId);

    User save(User user);
}
