package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.domain.product.CupSize;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 장바구니 항목의 옵션 조합 (Value Object)
 *
 * 사이즈, 당도, 얼음량, 온도, 토핑 집합으로 구성되며 값 동등성으로 병합 여부를 판단합니다.
 * 토핑은 순서와 중복에 무관한 집합입니다.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CartCustomization {
    private final CupSize size;
    private final int sugarLevel;
    private final int iceLevel;
    private final Temperature temperature;
    private final Set<Long> toppingIds;

    private CartCustomization(CupSize size, int sugarLevel, int iceLevel, Temperature temperature, Set<Long> toppingIds) {
        this.size = size;
        this.sugarLevel = sugarLevel;
        this.iceLevel = iceLevel;
        this.temperature = temperature;
        this.toppingIds = toppingIds;
    }

    /**
     * 옵션 조합 생성. 생략된 값은 기본값(M, 50, 50, COLD, 토핑 없음)을 사용합니다.
     *
     * @throws InvalidCustomizationException 당도/얼음량이 0~100 범위를 벗어난 경우
     */
    public static CartCustomization of(CupSize size, Integer sugarLevel, Integer iceLevel,
                                       Temperature temperature, Collection<Long> toppingIds) {
        int sugar = sugarLevel != null ? sugarLevel : CartConstants.DEFAULT_SUGAR_LEVEL;
        int ice = iceLevel != null ? iceLevel : CartConstants.DEFAULT_ICE_LEVEL;
        validateLevel("당도", sugar);
        validateLevel("얼음량", ice);

        TreeSet<Long> toppings = new TreeSet<>();
        if (toppingIds != null) {
            toppingIds.stream().filter(id -> id != null).forEach(toppings::add);
        }

        return new CartCustomization(
                size != null ? size : CartConstants.DEFAULT_SIZE,
                sugar,
                ice,
                temperature != null ? temperature : CartConstants.DEFAULT_TEMPERATURE,
                Collections.unmodifiableSet(toppings)
        );
    }

    public CartCustomization withToppings(Collection<Long> toppingIds) {
        return of(size, sugarLevel, iceLevel, temperature, toppingIds);
    }

    private static void validateLevel(String name, int level) {
        if (level < CartConstants.MIN_LEVEL || level > CartConstants.MAX_LEVEL) {
            throw new InvalidCustomizationException(
                    String.format("%s은(는) %d~%d 범위여야 합니다: %d", name, CartConstants.MIN_LEVEL, CartConstants.MAX_LEVEL, level));
        }
    }
}
