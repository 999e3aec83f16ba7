package com.hhplus.coffeeshop.presentation.loyalty.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyTransactionResponse {

    @JsonProperty("transaction_id")
    private Long transactionId;

    private Long delta;

    private String type;

    private String description;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("balance_after")
    private Long balanceAfter;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
