package com.hhplus.coffeeshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * 커피숍 주문 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 알림 등 커밋 이후 부가 작업의 비동기 실행
 * - @EnableRetry: 포인트 적립 재시도
 * - @EnableAspectJAutoProxy: 분산락 / 저장소 예외 변환 Aspect
 */
@EnableAsync
@EnableRetry
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication
public class CoffeeShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoffeeShopApplication.class, args);
    }

}
