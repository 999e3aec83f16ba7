package com.hhplus.coffeeshop.domain.product;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가격 계산용 토핑 가격 스냅샷 (Redis 캐시 대상)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ToppingPrice {
    private Long toppingId;
    private String toppingName;
    private Long price;

    public static ToppingPrice from(Topping topping) {
        return new ToppingPrice(topping.getToppingId(), topping.getToppingName(), topping.getPrice());
    }
}
