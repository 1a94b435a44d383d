package com.agora.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 출석 날짜 계산에 쓰는 Clock.
 * <p>
 * 날짜 경계는 JVM 기본 시간대가 아니라 설정한 시간대를 따릅니다.
 * </p>
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(SigninProperties signinProperties) {
        return Clock.system(signinProperties.zoneId());
    }
}
