package com.hhplus.coffeeshop.infrastructure.config;

import com.hhplus.coffeeshop.common.exception.PersistenceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * 영속성 계층 장애 변환 Aspect
 *
 * application 계층 서비스 호출을 감싸 일시적인 DB 장애
 * (연결 실패, 락 타임아웃, 쿼리 타임아웃: TransientDataAccessException 하위 타입)를 PersistenceUnavailableException(503)으로 변환합니다.
 * 트랜잭션/분산락 Aspect보다 바깥에서 실행되므로 커밋 시점의 예외도 변환됩니다.
 *
 * 비즈니스 예외(BizException)와 그 외 예외는 그대로 전파합니다.
 */
@Aspect
@Component
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class PersistenceExceptionTranslationAspect {

    @Around("within(com.hhplus.coffeeshop.application..*) && @within(org.springframework.stereotype.Service)")
    public Object translate(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            String operation = joinPoint.getSignature().toShortString();
            log.error("[Persistence] 저장소 사용 불가 - operation: {}, cause: {}", operation, e.getClass().getSimpleName(), e);
            throw new PersistenceUnavailableException(operation, e);
        }
    }
}
