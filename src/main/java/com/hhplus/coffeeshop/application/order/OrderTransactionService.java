package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.cart.CartService;
import com.hhplus.coffeeshop.application.cart.dto.CartSummary;
import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.application.voucher.VoucherService;
import com.hhplus.coffeeshop.domain.cart.EmptyCartException;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderAmounts;
import com.hhplus.coffeeshop.domain.order.OrderLine;
import com.hhplus.coffeeshop.domain.order.OrderNumberGenerator;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.ReadyTimeEstimator;
import com.hhplus.coffeeshop.domain.order.event.OrderCreatedEvent;
import com.hhplus.coffeeshop.domain.voucher.Voucher;
import com.hhplus.coffeeshop.domain.voucher.VoucherValidationResult;
import com.hhplus.coffeeshop.infrastructure.lock.DistributedLock;
import com.hhplus.coffeeshop.infrastructure.lock.LockKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * OrderTransactionService - 주문 생성 트랜잭션 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리된 독립 서비스 (self-invocation 시 @Transactional 미적용 방지)
 * - 장바구니 → 주문 변환(materialization)을 하나의 트랜잭션으로 처리
 *
 * 한 트랜잭션에서 처리되는 작업:
 * 1. 장바구니 요약 (가격 고정)
 * 2. 바우처 잠금 + 검증 (실패 시 할인 0원으로 진행)
 * 3. 배달비 / 합계 / 주문번호 / 예상 준비 시각 계산
 * 4. 주문 + 주문 항목 저장
 * 5. 바우처 사용 처리 (전체/사용자별 횟수 + 이력)
 * 6. 장바구니 비우기
 * 7. OrderCreatedEvent 발행 (커밋 후 포인트 적립)
 *
 * 어느 단계에서든 실패하면 전체 롤백되며, 호출자는 같은 요청을 다시 시도할 수 있습니다.
 *
 * 장바구니 담기/수정/삭제와 같은 cart:{userId} 분산락을 커밋 이후까지 잡습니다.
 * 변환 도중 담긴 항목이 비우기에 함께 지워지거나, 같은 장바구니가 두 번 주문되지 않습니다.
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);
    private static final int MAX_ORDER_NUMBER_ATTEMPTS = 5;

    private final OrderRepository orderRepository;
    private final CartService cartService;
    private final VoucherService voucherService;
    private final OrderCalculator orderCalculator;
    private final OrderNumberGenerator orderNumberGenerator;
    private final ReadyTimeEstimator readyTimeEstimator;
    private final ApplicationEventPublisher eventPublisher;

    public OrderTransactionService(OrderRepository orderRepository,
                                   CartService cartService,
                                   VoucherService voucherService,
                                   OrderCalculator orderCalculator,
                                   OrderNumberGenerator orderNumberGenerator,
                                   ReadyTimeEstimator readyTimeEstimator,
                                   ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.cartService = cartService;
        this.voucherService = voucherService;
        this.orderCalculator = orderCalculator;
        this.orderNumberGenerator = orderNumberGenerator;
        this.readyTimeEstimator = readyTimeEstimator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 장바구니 → 주문 변환
     *
     * @throws EmptyCartException 장바구니가 비어 있는 경우
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE, leaseTime = 10)
    @Transactional(rollbackFor = Exception.class)
    public Order materialize(Long userId, CreateOrderCommand command) {
        CartSummary cart = cartService.summary(userId);
        if (cart.isEmpty()) {
            throw new EmptyCartException(userId);
        }
        List<OrderLine> lines = orderCalculator.toOrderLines(cart);
        long subtotal = cart.getSubtotal();

        Voucher voucher = null;
        long discount = 0L;
        if (command.hasVoucherCode()) {
            VoucherValidationResult result = voucherService.validateForRedemption(userId, command.getVoucherCode(), subtotal);
            if (result.isOk()) {
                voucher = result.getVoucher();
                discount = voucherService.computeDiscount(subtotal, voucher);
            } else {
                log.warn("[OrderTransactionService] 바우처 미적용 (할인 0원으로 진행) - userId={}, code={}, reason={}",
                        userId, command.getVoucherCode(), result.getReason());
            }
        }

        OrderAmounts amounts = orderCalculator.calculateAmounts(subtotal, discount, command.getOrderType());
        LocalDateTime now = LocalDateTime.now();

        Order order = Order.create(
                nextOrderNumber(now.toLocalDate()),
                userId,
                command.getOrderType(),
                command.destination(),
                command.getPaymentMethod(),
                command.getNotes(),
                amounts,
                voucher != null ? voucher.getVoucherId() : null,
                voucher != null ? voucher.getCode() : null,
                lines,
                readyTimeEstimator.estimate(command.getOrderType(), cart.getItemCount(), now),
                now
        );
        Order saved = orderRepository.save(order);

        if (voucher != null) {
            voucherService.redeem(voucher.getVoucherId(), userId, saved.getOrderId(), discount);
        }

        cartService.clear(userId);

        eventPublisher.publishEvent(new OrderCreatedEvent(
                this, saved.getOrderId(), saved.getOrderNumber(), userId, saved.getTotalAmount()));

        log.info("[OrderTransactionService] 주문 생성 - orderId={}, orderNumber={}, userId={}, subtotal={}, discount={}, deliveryFee={}, total={}",
                saved.getOrderId(), saved.getOrderNumber(), userId,
                amounts.getSubtotal(), amounts.getDiscountAmount(), amounts.getDeliveryFee(), amounts.getTotal());
        return saved;
    }

    /**
     * 기존 주문번호와 겹치지 않는 번호 생성
     */
    private String nextOrderNumber(LocalDate date) {
        for (int attempt = 1; attempt <= MAX_ORDER_NUMBER_ATTEMPTS; attempt++) {
            String candidate = orderNumberGenerator.generate(date);
            if (!orderRepository.existsByOrderNumber(candidate)) {
                return candidate;
            }
            log.warn("[OrderTransactionService] 주문번호 충돌, 재생성 - candidate={}, attempt={}", candidate, attempt);
        }
        throw new IllegalStateException("주문번호를 생성하지 못했습니다");
    }
}
