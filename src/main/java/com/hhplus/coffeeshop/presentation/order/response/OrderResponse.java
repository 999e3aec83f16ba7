package com.hhplus.coffeeshop.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_number")
    private String orderNumber;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("order_type")
    private String orderType;

    @JsonProperty("store_id")
    private Long storeId;

    @JsonProperty("delivery_address")
    private String deliveryAddress;

    @JsonProperty("table_number")
    private String tableNumber;

    private String notes;

    private Long subtotal;

    @JsonProperty("discount_amount")
    private Long discountAmount;

    @JsonProperty("delivery_fee")
    private Long deliveryFee;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("voucher_code")
    private String voucherCode;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("payment_status")
    private String paymentStatus;

    private String status;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("estimated_ready_at")
    private LocalDateTime estimatedReadyAt;

    @JsonProperty("cancellation_reason")
    private String cancellationReason;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("cancelled_at")
    private LocalDateTime cancelledAt;

    private List<OrderLineResponse> lines;
}
