package com.hhplus.coffeeshop.infrastructure.config;

import com.hhplus.coffeeshop.config.CommerceProperties;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyPolicy;
import com.hhplus.coffeeshop.domain.order.DeliveryFeePolicy;
import com.hhplus.coffeeshop.domain.order.OrderNumberGenerator;
import com.hhplus.coffeeshop.domain.order.ReadyTimeEstimator;
import com.hhplus.coffeeshop.domain.product.PriceCalculator;
import com.hhplus.coffeeshop.domain.voucher.VoucherPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

/**
 * DomainServiceConfig - Domain Services를 Spring Bean으로 등록
 *
 * Domain Services는 순수 비즈니스 로직만 포함하므로 외부 의존성이 없습니다.
 * 정책 값(적립률, 배달비, 준비 시간)은 CommerceProperties에서 주입합니다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public PriceCalculator priceCalculator() {
        return new PriceCalculator();
    }

    @Bean
    public VoucherPolicy voucherPolicy() {
        return new VoucherPolicy();
    }

    @Bean
    public LoyaltyPolicy loyaltyPolicy(CommerceProperties properties) {
        CommerceProperties.Loyalty loyalty = properties.getLoyalty();
        return new LoyaltyPolicy(loyalty.getPointsRate(), loyalty.getSilverThreshold(), loyalty.getGoldThreshold());
    }

    @Bean
    public DeliveryFeePolicy deliveryFeePolicy(CommerceProperties properties) {
        CommerceProperties.Delivery delivery = properties.getDelivery();
        return new DeliveryFeePolicy(delivery.getFreeShippingThreshold(), delivery.getBaseFee(), delivery.getDefaultDistanceKm());
    }

    @Bean
    public ReadyTimeEstimator readyTimeEstimator(CommerceProperties properties) {
        CommerceProperties.Order order = properties.getOrder();
        return new ReadyTimeEstimator(
                order.getBasePrepMinutes(),
                order.getPerItemMinutes(),
                order.getPickupOffsetMinutes(),
                order.getDeliveryOffsetMinutes(),
                order.getDineInOffsetMinutes()
        );
    }

    @Bean
    public OrderNumberGenerator orderNumberGenerator() {
        return new OrderNumberGenerator(new SecureRandom());
    }
}
