package com.hhplus.coffeeshop.presentation.loyalty.mapper;

import com.hhplus.coffeeshop.application.loyalty.dto.LoyaltyAccountView;
import com.hhplus.coffeeshop.application.loyalty.dto.LoyaltyTransactionView;
import com.hhplus.coffeeshop.application.loyalty.dto.ReconciliationResult;
import com.hhplus.coffeeshop.presentation.loyalty.response.LoyaltyAccountResponse;
import com.hhplus.coffeeshop.presentation.loyalty.response.LoyaltyTransactionResponse;
import com.hhplus.coffeeshop.presentation.loyalty.response.ReconciliationResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class LoyaltyMapper {

    public LoyaltyAccountResponse toAccountResponse(LoyaltyAccountView view) {
        return LoyaltyAccountResponse.builder()
                .userId(view.getUserId())
                .pointsBalance(view.getPointsBalance())
                .tier(view.getTier().name())
                .tierChanged(view.isTierChanged())
                .build();
    }

    public List<LoyaltyTransactionResponse> toTransactionResponses(List<LoyaltyTransactionView> views) {
        return views.stream()
                .map(view -> LoyaltyTransactionResponse.builder()
                        .transactionId(view.getTransactionId())
                        .delta(view.getDelta())
                        .type(view.getType().name())
                        .description(view.getDescription())
                        .orderId(view.getOrderId())
                        .balanceAfter(view.getBalanceAfter())
                        .createdAt(view.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    public ReconciliationResponse toReconciliationResponse(ReconciliationResult result) {
        return ReconciliationResponse.builder()
                .attempted(result.getAttempted())
                .resolved(result.getResolved())
                .stillFailing(result.getStillFailing())
                .build();
    }
}
