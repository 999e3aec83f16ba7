package com.hhplus.coffeeshop.application.cart.dto;

import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.product.CupSize;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * 장바구니 항목 부분 수정 (Patch)
 *
 * Optional.empty()인 필드는 변경하지 않습니다.
 * quantity가 0 이하이면 항목이 삭제됩니다.
 */
@Getter
@Builder
public class CartItemPatch {
    @Builder.Default
    private final Optional<CupSize> size = Optional.empty();
    @Builder.Default
    private final Optional<Integer> quantity = Optional.empty();
    @Builder.Default
    private final Optional<Integer> sugarLevel = Optional.empty();
    @Builder.Default
    private final Optional<Integer> iceLevel = Optional.empty();
    @Builder.Default
    private final Optional<Temperature> temperature = Optional.empty();
    @Builder.Default
    private final Optional<List<Long>> toppingIds = Optional.empty();
}
