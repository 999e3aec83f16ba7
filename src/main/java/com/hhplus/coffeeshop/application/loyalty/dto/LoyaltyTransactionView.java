package com.hhplus.coffeeshop.application.loyalty.dto;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransaction;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyTransactionView {
    private Long transactionId;
    private long delta;
    private LoyaltyTransactionType type;
    private String description;
    private Long orderId;
    private long balanceAfter;
    private LocalDateTime createdAt;

    public static LoyaltyTransactionView from(LoyaltyTransaction transaction) {
        return LoyaltyTransactionView.builder()
                .transactionId(transaction.getLoyaltyTransactionId())
                .delta(transaction.getDelta())
                .type(transaction.getType())
                .description(transaction.getDescription())
                .orderId(transaction.getOrderId())
                .balanceAfter(transaction.getBalanceAfter())
                .createdAt(transaction.getCreatedAt())
                .build();
    }
}
