package com.hhplus.coffeeshop.common.exception;

/**
 * 저장소(DB, 락 타임아웃 등)가 일시적으로 응답하지 못할 때 발생하는 예외 (503)
 *
 * 이전 시도가 완전히 롤백되었으므로 호출자는 동일한 요청을 재시도할 수 있습니다.
 */
public class PersistenceUnavailableException extends SystemException {

    public PersistenceUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.PERSISTENCE_UNAVAILABLE, String.format("작업: %s", operation), cause);
    }
}
