package com.agora.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.UUID;

/**
 * 큐에 저장되는 작업 단위.
 *
 * @param id 작업 ID (멱등 처리 키로 사용)
 * @param name 작업 이름 (핸들러 매핑 키)
 * @param payload JSON 페이로드
 * @param attempts 실패한 시도 횟수
 * @param enqueuedAt 최초 등록 시각 (epoch millis)
 * @param lastError 마지막 실패 사유
 * @author Agora
 * @version 1.0
 */
public record TaskEnvelope(
    String id,
    String name,
    String payload,
    int attempts,
    long enqueuedAt,
    String lastError
) {

    public static TaskEnvelope create(String name, String payload) {
        return new TaskEnvelope(UUID.randomUUID().toString(), name, payload, 0, System.currentTimeMillis(), null);
    }

    /**
     * 실패 한 번을 반영한 새 봉투를 반환합니다.
     *
     * @param error 실패 사유
     * @return 시도 횟수가 1 증가한 봉투
     */
    public TaskEnvelope failed(String error) {
        return new TaskEnvelope(id, name, payload, attempts + 1, enqueuedAt, error);
    }

    /**
     * 페이로드를 지정한 타입으로 복원합니다.
     *
     * @param objectMapper JSON 매퍼
     * @param type 페이로드 타입
     * @param <T> 페이로드 타입
     * @return 복원된 페이로드
     * @throws TaskSerializationException 페이로드 형식이 맞지 않는 경우
     */
    public <T> T payloadAs(ObjectMapper objectMapper, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("작업 페이로드 역직렬화 실패: " + name, e);
        }
    }
}
