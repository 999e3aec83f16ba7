package com.hhplus.coffeeshop.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 주문 생성 요청 DTO
 *
 * 주문 유형별 필수 항목:
 * - PICKUP: store_id
 * - DELIVERY: delivery_address
 * - DINE_IN: table_number
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @NotBlank
    @JsonProperty("order_type")
    private String orderType;

    @NotBlank
    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("store_id")
    private Long storeId;

    @Size(max = 500)
    @JsonProperty("delivery_address")
    private String deliveryAddress;

    @Size(max = 20)
    @JsonProperty("table_number")
    private String tableNumber;

    @Size(max = 500)
    private String notes;

    @JsonProperty("voucher_code")
    private String voucherCode;
}
