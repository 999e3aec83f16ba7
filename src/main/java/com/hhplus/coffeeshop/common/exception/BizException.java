package com.hhplus.coffeeshop.common.exception;

/**
 * 주문 엔진 예외의 최상위 클래스
 *
 * ErrorCode가 응답 코드와 HTTP 상태를 결정합니다.
 * 메시지는 "ErrorCode 기본 메시지 | 상세" 형식입니다.
 *
 * BizException
 * ├─ DomainException (규칙 위반, 4XX)
 * └─ SystemException (저장소/락 장애, 5XX)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, null, cause);
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        this(errorCode, detailMessage, null);
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(compose(errorCode, detailMessage), cause);
        this.errorCode = errorCode;
    }

    private static String compose(ErrorCode errorCode, String detailMessage) {
        if (detailMessage == null || detailMessage.isBlank()) {
            return errorCode.getMessage();
        }
        return errorCode.getMessage() + " | " + detailMessage;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public boolean isServerError() {
        return errorCode.getStatusCode() >= 500;
    }
}
