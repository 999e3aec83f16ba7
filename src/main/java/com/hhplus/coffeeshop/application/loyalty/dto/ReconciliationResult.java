package com.hhplus.coffeeshop.application.loyalty.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 적립 실패 재처리 결과
 */
@Getter
@AllArgsConstructor
public class ReconciliationResult {
    private final int attempted;
    private final int resolved;
    private final int stillFailing;
}
