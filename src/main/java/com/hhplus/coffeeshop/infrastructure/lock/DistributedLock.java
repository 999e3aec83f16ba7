package com.hhplus.coffeeshop.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 분산락 어노테이션
 *
 * 메서드에 붙여서 Redis 기반 분산락을 적용합니다.
 * 키는 Spring EL로 평가되므로 메서드 파라미터를 동적 키로 사용할 수 있습니다.
 *
 * 예제:
 * @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
 * public CartLineView addItem(Long userId, AddCartItemCommand command) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * Redis 분산락 키 (Spring EL)
     *
     * - #p0, #p1, ... : 위치 기반 메서드 파라미터
     * - #args : 전체 파라미터 배열
     */
    String key();

    /**
     * 락 획득 대기 시간 (기본값: 5초)
     */
    long waitTime() default 5;

    /**
     * 락 유지 시간 (기본값: 3초)
     * 명시적으로 해제하지 않아도 이 시간이 지나면 자동 해제됩니다.
     */
    long leaseTime() default 3;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
