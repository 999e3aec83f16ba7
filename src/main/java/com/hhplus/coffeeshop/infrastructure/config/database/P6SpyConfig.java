package com.hhplus.coffeeshop.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정 클래스
 *
 * local / test 프로필에서 바인딩된 인자가 포함된 완성된 SQL을 보기 좋은 형식으로 로깅합니다.
 */
@Configuration
@Profile({"local", "test"})
public class P6SpyConfig {

    @PostConstruct
    public void registerMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
