package com.agora.task;

/**
 * 큐에서 꺼낸 작업과, 완료/재시도 처리 시 큐에 돌려줄 수신 증표.
 *
 * @param envelope 작업
 * @param receipt 처리 중 목록에서 이 작업을 가리키는 값
 * @author Agora
 * @version 1.0
 */
public record QueuedTask(TaskEnvelope envelope, String receipt) {
}
