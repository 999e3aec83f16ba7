package com.hhplus.coffeeshop.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * 주문 엔진 설정값 (application.yml의 coffeeshop.*)
 *
 * 기본값은 운영 기본 정책과 동일하며, 프로필별 yml에서 덮어쓸 수 있습니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "coffeeshop")
public class CommerceProperties {

    private Cart cart = new Cart();
    private Loyalty loyalty = new Loyalty();
    private Delivery delivery = new Delivery();
    private Order order = new Order();

    @Getter
    @Setter
    public static class Cart {
        /** 한 번에 담거나 변경할 수 있는 최대 수량 */
        private int maxQuantity = 100;
    }

    @Getter
    @Setter
    public static class Loyalty {
        /** 결제 금액 1원당 적립 포인트 */
        private BigDecimal pointsRate = new BigDecimal("0.01");
        private long silverThreshold = 1000;
        private long goldThreshold = 5000;
    }

    @Getter
    @Setter
    public static class Delivery {
        private long freeShippingThreshold = 200_000;
        private long baseFee = 20_000;
        private int defaultDistanceKm = 5;
    }

    @Getter
    @Setter
    public static class Order {
        private int basePrepMinutes = 15;
        private int perItemMinutes = 3;
        private int pickupOffsetMinutes = 5;
        private int deliveryOffsetMinutes = 30;
        private int dineInOffsetMinutes = 0;
    }
}
