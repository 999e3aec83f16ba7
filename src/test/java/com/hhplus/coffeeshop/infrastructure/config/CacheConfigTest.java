package com.hhplus.coffeeshop.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CacheConfig 단위 테스트
 *
 * 카탈로그 캐시 TTL은 10분
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CacheConfig 단위 테스트")
class CacheConfigTest {

    @Mock
    private RedisConnectionFactory redisConnectionFactory;

    @Test
    @DisplayName("카탈로그 캐시는 10분 TTL로 등록된다")
    void catalogCachesExpireAfterTenMinutes() {
        RedisCacheManager cacheManager = (RedisCacheManager) new CacheConfig(redisConnectionFactory).cacheManager();
        cacheManager.afterPropertiesSet();

        Map<String, RedisCacheConfiguration> configurations = cacheManager.getCacheConfigurations();

        assertThat(configurations.get(CacheNames.PRODUCT_PRICING).getTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(configurations.get(CacheNames.TOPPING_CATALOG).getTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(configurations.get(CacheNames.PRODUCT_PRICING).getAllowCacheNullValues()).isFalse();
    }
}
