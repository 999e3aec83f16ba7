package com.hhplus.coffeeshop.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Redisson 설정 (분산 락)
 *
 * Redisson은 spring.data.redis 설정을 자동으로 사용하지 않으므로,
 * application.yml의 spring.data.redis 값을 읽어 RedissonClient Bean을 직접 구성합니다.
 *
 * 용도:
 * - 장바구니 담기 직렬화 (cart:{userId})
 */
@Configuration
public class RedissonConfig {

    @Value("${spring.data.redis.host}")
    private String host;

    @Value("${spring.data.redis.port}")
    private int port;

    @Value("${spring.data.redis.database:0}")
    private int database;

    @Value("${spring.data.redis.timeout:2000ms}")
    private Duration timeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setTimeout((int) timeout.toMillis())
                .setConnectTimeout((int) timeout.toMillis())
                .setConnectionPoolSize(20)
                .setConnectionMinimumIdleSize(5);

        return Redisson.create(config);
    }
}
