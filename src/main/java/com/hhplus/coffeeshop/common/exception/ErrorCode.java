package com.hhplus.coffeeshop.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_ORDER_INVALID_TRANSITION, SYSTEM_PERSISTENCE_UNAVAILABLE
 */
public enum ErrorCode {

    // ========== Validation (400) ==========

    INVALID_REQUEST("DOMAIN_INVALID_REQUEST", "유효하지 않은 요청입니다", 400),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),
    INVALID_CUSTOMIZATION("DOMAIN_CART_INVALID_CUSTOMIZATION", "유효하지 않은 옵션입니다", 400),
    MISSING_REQUIRED_FIELD("DOMAIN_ORDER_MISSING_REQUIRED_FIELD", "주문 유형에 필요한 항목이 누락되었습니다", 400),

    // ========== Not Found (404) ==========

    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    VOUCHER_NOT_FOUND("DOMAIN_VOUCHER_NOT_FOUND", "바우처를 찾을 수 없습니다", 404),
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    NOTIFICATION_NOT_FOUND("DOMAIN_NOTIFICATION_NOT_FOUND", "알림을 찾을 수 없습니다", 404),

    // ========== Business Rule ==========

    EMPTY_CART("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    INVALID_ORDER_TRANSITION("DOMAIN_ORDER_INVALID_TRANSITION", "허용되지 않은 주문 상태 변경입니다", 409),
    USER_MISMATCH("DOMAIN_ORDER_USER_MISMATCH", "주문 사용자가 일치하지 않습니다", 403),
    INSUFFICIENT_POINTS("DOMAIN_LOYALTY_INSUFFICIENT_POINTS", "포인트가 부족합니다", 400),
    VOUCHER_REJECTED("DOMAIN_VOUCHER_REJECTED", "사용할 수 없는 바우처입니다", 400),

    // ========== System Errors (5XX) ==========

    PERSISTENCE_UNAVAILABLE("SYSTEM_PERSISTENCE_UNAVAILABLE", "저장소를 일시적으로 사용할 수 없습니다", 503),
    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "분산락 획득에 실패했습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
