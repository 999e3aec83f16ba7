package com.hhplus.coffeeshop.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 입력 검증 실패, 허용되지 않은 상태 전이, 리소스 미존재 등
 * - 클라이언트 오류(4XX)로 응답하며 재시도 대상이 아님
 *
 * 사용 예:
 * - CartLineNotFoundException: 장바구니 항목 조회 실패
 * - InvalidOrderTransitionException: 허용되지 않은 주문 상태 전이
 * - InsufficientPointsException: 포인트 부족
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
