package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.cart.CartService;
import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.application.order.dto.OrderTrackingView;
import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.application.order.dto.ReorderResult;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderLine;
import com.hhplus.coffeeshop.domain.order.OrderNotFoundException;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.product.ProductNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 관련 비즈니스 로직 조정자 (Application 계층)
 *
 * 아키텍처:
 * - OrderValidator: 트랜잭션 이전 검증
 * - OrderCalculator: 주문 항목 / 금액 계산
 * - OrderTransactionService: 장바구니 → 주문 변환 트랜잭션
 * - OrderLifecycleService: 상태 전환 / 취소
 *
 * 플로우 (주문 생성):
 * OrderController
 *     ↓
 * OrderService.createFromCart()
 *     ├─ 1단계: 검증 (OrderValidator, 트랜잭션 없음)
 *     └─ 2단계: 변환 (OrderTransactionService, 단일 트랜잭션)
 *
 * 포인트 적립은 주문 커밋 이후 OrderCreatedEvent 리스너에서 처리됩니다.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderValidator orderValidator;
    private final OrderTransactionService orderTransactionService;
    private final CartService cartService;

    public OrderService(OrderRepository orderRepository,
                        OrderValidator orderValidator,
                        OrderTransactionService orderTransactionService,
                        CartService cartService) {
        this.orderRepository = orderRepository;
        this.orderValidator = orderValidator;
        this.orderTransactionService = orderTransactionService;
        this.cartService = cartService;
    }

    /**
     * 장바구니로 주문 생성
     *
     * 검증 실패 시 트랜잭션이 시작되지 않으므로 장바구니와 바우처는 변경되지 않습니다.
     */
    public OrderView createFromCart(Long userId, CreateOrderCommand command) {
        orderValidator.validateCreate(userId, command);
        Order order = orderTransactionService.materialize(userId, command);
        return OrderView.from(order);
    }

    /**
     * 주문 단건 조회 (소유자 확인 없음, 관리자용)
     */
    @Transactional(readOnly = true)
    public OrderView get(Long orderId) {
        return OrderView.from(loadOrder(orderId));
    }

    /**
     * 사용자 본인 주문 조회
     */
    @Transactional(readOnly = true)
    public OrderView getOwned(Long orderId, Long userId) {
        Order order = loadOrder(orderId);
        orderValidator.validateOwner(order, userId);
        return OrderView.from(order);
    }

    /**
     * 주문번호로 본인 주문 조회
     */
    @Transactional(readOnly = true)
    public OrderView getByNumber(String orderNumber, Long userId) {
        Order order = orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new OrderNotFoundException(orderNumber));
        orderValidator.validateOwner(order, userId);
        return OrderView.from(order);
    }

    /**
     * 사용자 주문 목록 (최신순)
     */
    @Transactional(readOnly = true)
    public List<OrderView> getForUser(Long userId) {
        return orderRepository.findByUserId(userId).stream()
                .map(OrderView::from)
                .collect(Collectors.toList());
    }

    /**
     * 상태별 주문 목록 (관리자용, 오래된 순)
     *
     * @throws IllegalArgumentException 알 수 없는 상태 값
     */
    @Transactional(readOnly = true)
    public List<OrderView> listByStatus(String status) {
        OrderStatus parsed = OrderStatus.parse(status)
                .orElseThrow(() -> new IllegalArgumentException("유효하지 않은 주문 상태입니다: " + status));
        return orderRepository.findByStatus(parsed).stream()
                .map(OrderView::from)
                .collect(Collectors.toList());
    }

    /**
     * 주문 추적 타임라인
     *
     * 현재 상태까지의 단계는 done, 현재 단계는 current로 표시합니다.
     */
    @Transactional(readOnly = true)
    public OrderTrackingView track(Long orderId, Long userId) {
        Order order = loadOrder(orderId);
        orderValidator.validateOwner(order, userId);

        List<OrderTrackingView.Step> steps;
        if (order.getStatus() == OrderStatus.CANCELLED) {
            steps = Collections.emptyList();
        } else {
            List<OrderStatus> progression = OrderStatus.progressionFor(order.getOrderType());
            int currentIndex = progression.indexOf(order.getStatus());
            steps = new ArrayList<>();
            for (int i = 0; i < progression.size(); i++) {
                OrderStatus step = progression.get(i);
                steps.add(new OrderTrackingView.Step(step, step.getDisplayName(), i <= currentIndex, i == currentIndex));
            }
        }

        return OrderTrackingView.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .orderType(order.getOrderType())
                .status(order.getStatus())
                .estimatedReadyAt(order.getEstimatedReadyAt())
                .steps(steps)
                .build();
    }

    /**
     * 지난 주문을 장바구니에 다시 담기
     *
     * 가격은 현재 카탈로그 기준으로 다시 계산되며, 판매 중지된 상품은 건너뜁니다.
     */
    public ReorderResult reorder(Long orderId, Long userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        orderValidator.validateOwner(order, userId);

        int added = 0;
        int skipped = 0;
        for (OrderLine line : order.getOrderLines()) {
            try {
                cartService.addItem(userId, toAddCommand(line));
                added++;
            } catch (ProductNotFoundException e) {
                log.warn("[OrderService] 재주문 항목 건너뜀 - orderId={}, productId={}, reason={}",
                        orderId, line.getProductId(), e.getMessage());
                skipped++;
            }
        }
        log.info("[OrderService] 재주문 완료 - orderId={}, userId={}, added={}, skipped={}", orderId, userId, added, skipped);
        return new ReorderResult(orderId, added, skipped);
    }

    private AddCartItemCommand toAddCommand(OrderLine line) {
        return AddCartItemCommand.builder()
                .productId(line.getProductId())
                .size(line.getSize())
                .quantity(line.getQuantity())
                .sugarLevel(line.getSugarLevel())
                .iceLevel(line.getIceLevel())
                .temperature(line.getTemperature())
                .toppingIds(new ArrayList<>(line.getToppingIds()))
                .build();
    }

    private Order loadOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
