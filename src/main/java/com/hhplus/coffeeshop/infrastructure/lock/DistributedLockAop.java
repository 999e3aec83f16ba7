package com.hhplus.coffeeshop.infrastructure.lock;

import com.hhplus.coffeeshop.common.exception.ErrorCode;
import com.hhplus.coffeeshop.common.exception.SystemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 분산락 AOP 처리
 *
 * 실행 순서:
 * 1. 락 획득 (이 Aspect, @Transactional보다 바깥)
 * 2. @Transactional 시작
 * 3. 비즈니스 로직
 * 4. 커밋/롤백
 * 5. 락 해제
 *
 * 호출 시점에 이미 바깥 트랜잭션이 열려 있으면 그 트랜잭션이 끝난 뒤에 해제되도록
 * TransactionSynchronization에 해제를 맡깁니다.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
@Order(Ordered.LOWEST_PRECEDENCE - 1000)
public class DistributedLockAop {

    private final RedissonClient redissonClient;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(distributedLock)")
    public Object around(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        String lockKey = generateKey(joinPoint, distributedLock.key());
        RLock rLock = redissonClient.getLock(lockKey);

        boolean lockAcquired;
        try {
            lockAcquired = rLock.tryLock(
                    distributedLock.waitTime(),
                    distributedLock.leaseTime(),
                    distributedLock.timeUnit()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[DistributedLock] 락 대기 중 스레드 인터럽트 - key: {}", lockKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + lockKey, e);
        }

        if (!lockAcquired) {
            log.warn("[DistributedLock] 락 획득 실패 - key: {} (waitTime 초과)", lockKey);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + lockKey);
        }
        log.debug("[DistributedLock] 락 획득 - key: {}", lockKey);

        boolean deferred = false;
        try {
            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new LockReleaseSynchronization(rLock, lockKey));
                deferred = true;
            }
            return joinPoint.proceed();
        } finally {
            if (!deferred) {
                release(rLock, lockKey);
            }
        }
    }

    private static void release(RLock rLock, String lockKey) {
        if (rLock.isHeldByCurrentThread()) {
            rLock.unlock();
            log.debug("[DistributedLock] 락 해제 - key: {}", lockKey);
        } else {
            log.warn("[DistributedLock] 락이 이미 만료됨 (leaseTime 초과) - key: {}", lockKey);
        }
    }

    /**
     * 바깥 트랜잭션 완료 후 락을 해제합니다.
     */
    private static class LockReleaseSynchronization implements TransactionSynchronization {
        private final RLock rLock;
        private final String lockKey;

        LockReleaseSynchronization(RLock rLock, String lockKey) {
            this.rLock = rLock;
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            try {
                release(rLock, lockKey);
            } catch (RuntimeException e) {
                // afterCompletion에서 던진 예외는 호출자에게 전파되지 않음
                log.error("[DistributedLock] 락 해제 중 오류 - key: {}, status: {}", lockKey, status, e);
            }
        }
    }

    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        String key = expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        log.debug("[DistributedLock] 키 생성 - method: {}, key: {}", signature.getName(), key);
        return key;
    }
}
