package com.agora.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 출석 기능 운영 설정.
 *
 * @param lockLease 사용자별 락 유지 시간. 출석 트랜잭션의 최악 소요 시간보다 길어야 한다
 * @param lockWait 락 획득 최대 대기 시간
 * @param settingsCacheTtl 출석 설정 캐시 TTL
 * @param dailyRankingTtl 일간 랭킹 키 TTL
 * @param statsSyncInterval 랭킹 재구성 주기
 * @param zone 출석 날짜를 정하는 시간대
 */
@ConfigurationProperties(prefix = "agora.signin")
public record SigninProperties(
    @DefaultValue("10s") Duration lockLease,
    @DefaultValue("5s") Duration lockWait,
    @DefaultValue("60s") Duration settingsCacheTtl,
    @DefaultValue("30d") Duration dailyRankingTtl,
    @DefaultValue("5m") Duration statsSyncInterval,
    @DefaultValue("Asia/Seoul") String zone
) {

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
