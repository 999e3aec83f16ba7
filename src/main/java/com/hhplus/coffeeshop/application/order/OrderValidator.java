package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.domain.order.MissingRequiredFieldException;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.UserMismatchException;
import com.hhplus.coffeeshop.domain.user.UserNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import org.springframework.stereotype.Component;

/**
 * OrderValidator - 주문 관련 검증 전담
 *
 * 트랜잭션 시작 전에 실행되므로 검증 실패 시 어떤 행도 생성되지 않습니다.
 */
@Component
public class OrderValidator {

    private final UserRepository userRepository;

    public OrderValidator(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * 주문 생성 요청 검증
     *
     * @throws UserNotFoundException 사용자 없음
     * @throws IllegalArgumentException 주문 유형 또는 결제 수단 누락
     * @throws MissingRequiredFieldException 주문 유형별 필수 항목 누락
     */
    public void validateCreate(Long userId, CreateOrderCommand command) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        if (command.getOrderType() == null) {
            throw new IllegalArgumentException("주문 유형은 필수입니다");
        }
        if (command.getPaymentMethod() == null) {
            throw new IllegalArgumentException("결제 수단은 필수입니다");
        }
        command.destination().validateFor(command.getOrderType());
    }

    /**
     * 주문 소유자 검증
     *
     * @throws UserMismatchException 요청 사용자가 주문 소유자가 아닌 경우
     */
    public void validateOwner(Order order, Long userId) {
        if (!order.isOwnedBy(userId)) {
            throw new UserMismatchException(order.getOrderId(), userId);
        }
    }
}
