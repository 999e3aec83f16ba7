package com.hhplus.coffeeshop.application.cart.dto;

import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.product.CupSize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 항목 추가 커맨드 (Application layer 내부 DTO)
 * 생략된 옵션은 기본값(M, 당도 50, 얼음 50, COLD, 토핑 없음)이 적용됩니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemCommand {
    private Long productId;
    private CupSize size;
    private Integer quantity;
    private Integer sugarLevel;
    private Integer iceLevel;
    private Temperature temperature;
    private List<Long> toppingIds;
}
