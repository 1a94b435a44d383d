package com.agora.task;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 작업 관리자 설정.
 *
 * @param enabled 애플리케이션 시작 시 워커와 스케줄러를 띄울지 여부
 * @param keyPrefix Redis 키 접두사
 * @param workers 워커 스레드 수
 * @param maxAttempts 데드 레터로 보내기 전 최대 시도 횟수
 * @param backoffInitial 첫 재시도 대기 시간
 * @param backoffMultiplier 재시도마다 곱해지는 배수
 * @param backoffMax 재시도 대기 시간 상한
 * @param pollInterval 큐가 비어 있을 때 다시 확인하는 간격
 * @param visibilityTimeout 꺼낸 작업이 ack 없이 processing에 머물 수 있는 시간
 * @param shutdownTimeout 중지 시 실행 중 작업을 기다리는 최대 시간
 * @param deadLetterLimit 보관할 데드 레터 최대 개수
 */
@ConfigurationProperties(prefix = "agora.task")
public record TaskProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("task") String keyPrefix,
    @DefaultValue("4") int workers,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("1s") Duration backoffInitial,
    @DefaultValue("2.0") double backoffMultiplier,
    @DefaultValue("1m") Duration backoffMax,
    @DefaultValue("1s") Duration pollInterval,
    @DefaultValue("5m") Duration visibilityTimeout,
    @DefaultValue("10s") Duration shutdownTimeout,
    @DefaultValue("1000") int deadLetterLimit
) {
    public TaskProperties {
        if (workers < 1) {
            throw new IllegalArgumentException("workers는 1 이상이어야 합니다: " + workers);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다: " + maxAttempts);
        }
    }
}
