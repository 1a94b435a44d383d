package com.agora.task;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 작업 큐 저장소.
 * <p>
 * 작업은 다음 네 영역 중 하나에 있습니다.
 * <ul>
 *   <li>pending: 실행 대기</li>
 *   <li>processing: 워커가 꺼내 실행 중 (가시성 만료 시각과 함께 보관)</li>
 *   <li>delayed: 재시도 대기 (실행 예정 시각과 함께 보관)</li>
 *   <li>dead: 최대 시도 횟수를 넘겨 보관된 작업</li>
 * </ul>
 * 꺼낸 작업은 ack 전까지 processing에 남으므로, 워커가 죽어도 가시성 만료 후 pending으로 되돌아옵니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface TaskQueue {

    void push(TaskEnvelope envelope);

    /**
     * 대기 작업 하나를 꺼내 processing으로 옮깁니다.
     *
     * @param visibilityTimeout 이 시간 안에 ack 되지 않으면 다시 pending으로 돌아감
     * @return 꺼낸 작업, 없으면 empty
     */
    Optional<QueuedTask> poll(Duration visibilityTimeout);

    void ack(QueuedTask task);

    /**
     * processing에서 제거하고 {@code delay} 뒤에 다시 실행되도록 delayed에 넣습니다.
     */
    void retry(QueuedTask task, TaskEnvelope updated, Duration delay);

    void deadLetter(QueuedTask task, TaskEnvelope updated);

    /**
     * processing에서 제거하고 pending 맨 앞으로 되돌립니다.
     *
     * @return 되돌렸으면 true, 이미 ack 되었으면 false
     */
    boolean requeue(QueuedTask task);

    /**
     * 실행 시각이 지난 재시도 작업과 가시성이 만료된 처리 중 작업을 pending으로 옮깁니다.
     *
     * @param now 기준 시각
     * @return 옮긴 작업 수
     */
    int promoteDue(Instant now);

    long pendingCount();

    List<TaskEnvelope> deadLetters(int limit);
}
