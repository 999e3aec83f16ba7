package com.hhplus.coffeeshop.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 금액 불변식 검증
 * - 주문 상태 전환 (OrderStatus 상태 머신)
 * - 완료/취소 시각 기록
 *
 * 핵심 비즈니스 규칙:
 * - total = subtotal - discount + deliveryFee, total >= 0
 * - 생성 후에는 상태, 결제 상태, 시각 정보만 변경 가능
 * - 주문 항목은 생성 시점에 고정
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_orders_order_number", columnNames = "order_number"),
        indexes = {
                @Index(name = "idx_orders_user", columnList = "user_id, created_at"),
                @Index(name = "idx_orders_status", columnList = "order_status")
        })
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", nullable = false, length = 30)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderType orderType;

    @Column(name = "store_id")
    private Long storeId;

    @Column(name = "delivery_address", length = 500)
    private String deliveryAddress;

    @Column(name = "table_number", length = 20)
    private String tableNumber;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "subtotal", nullable = false)
    private Long subtotal;

    @Column(name = "discount_amount", nullable = false)
    private Long discountAmount;

    @Column(name = "delivery_fee", nullable = false)
    private Long deliveryFee;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    @Column(name = "voucher_id")
    private Long voucherId;

    @Column(name = "voucher_code", length = 50)
    private String voucherCode;

    @Column(name = "payment_method", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "order_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "estimated_ready_at")
    private LocalDateTime estimatedReadyAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * 주문 항목 관계
     * cascade = PERSIST만 설정: 주문과 함께 저장되고 이후 변경되지 않음
     */
    @OneToMany(cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OrderBy("orderLineId ASC")
    @Builder.Default
    private List<OrderLine> orderLines = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 최소 1개 이상의 주문 항목
     * - 할인액은 0 이상 subtotal 이하, 배달비는 0 이상
     * - total = subtotal - discount + deliveryFee (호출자가 계산한 값과 일치해야 함)
     */
    public static Order create(String orderNumber, Long userId, OrderType orderType, OrderDestination destination,
                               PaymentMethod paymentMethod, String notes, OrderAmounts amounts,
                               Long voucherId, String voucherCode, List<OrderLine> lines,
                               LocalDateTime estimatedReadyAt, LocalDateTime now) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 최소 1개 이상이어야 합니다");
        }
        Objects.requireNonNull(orderType, "주문 유형은 필수입니다");
        Objects.requireNonNull(paymentMethod, "결제 수단은 필수입니다");
        amounts.verify();

        long lineTotal = lines.stream().mapToLong(OrderLine::getLineSubtotal).sum();
        if (lineTotal != amounts.getSubtotal()) {
            throw new IllegalArgumentException(String.format(
                    "주문 항목 합계(%d)와 주문 금액(%d)이 일치하지 않습니다", lineTotal, amounts.getSubtotal()));
        }

        return Order.builder()
                .orderNumber(orderNumber)
                .userId(userId)
                .orderType(orderType)
                .storeId(destination.getStoreId())
                .deliveryAddress(destination.getDeliveryAddress())
                .tableNumber(destination.getTableNumber())
                .notes(notes)
                .subtotal(amounts.getSubtotal())
                .discountAmount(amounts.getDiscountAmount())
                .deliveryFee(amounts.getDeliveryFee())
                .totalAmount(amounts.getTotal())
                .voucherId(voucherId)
                .voucherCode(voucherCode)
                .paymentMethod(paymentMethod)
                .paymentStatus(PaymentStatus.PENDING)
                .status(OrderStatus.PENDING)
                .estimatedReadyAt(estimatedReadyAt)
                .createdAt(now)
                .updatedAt(now)
                .orderLines(new ArrayList<>(lines))
                .build();
    }

    /**
     * 상태 전환
     *
     * COMPLETED → completedAt, CANCELLED → cancelledAt 기록
     *
     * @return 전환 이전 상태
     * @throws InvalidOrderTransitionException 허용되지 않은 전환 (주문은 변경되지 않음)
     */
    public OrderStatus transitionTo(OrderStatus next, LocalDateTime now) {
        if (!status.canTransitionTo(next, orderType)) {
            throw new InvalidOrderTransitionException(orderId, status, next);
        }
        OrderStatus previous = this.status;
        this.status = next;
        this.updatedAt = now;
        if (next == OrderStatus.COMPLETED) {
            this.completedAt = now;
        } else if (next == OrderStatus.CANCELLED) {
            this.cancelledAt = now;
        }
        return previous;
    }

    /**
     * 주문 취소 (PENDING, CONFIRMED에서만 가능)
     */
    public OrderStatus cancel(String reason, LocalDateTime now) {
        OrderStatus previous = transitionTo(OrderStatus.CANCELLED, now);
        this.cancellationReason = reason;
        return previous;
    }

    public void changePaymentStatus(PaymentStatus paymentStatus, LocalDateTime now) {
        this.paymentStatus = Objects.requireNonNull(paymentStatus, "결제 상태는 필수입니다");
        this.updatedAt = now;
    }

    public boolean isOwnedBy(Long userId) {
        return Objects.equals(this.userId, userId);
    }

    public int itemCount() {
        return orderLines.stream().mapToInt(OrderLine::getQuantity).sum();
    }

    public List<OrderLine> getOrderLines() {
        return Collections.unmodifiableList(orderLines);
    }
}
