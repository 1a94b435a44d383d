package com.agora.task;

/**
 * 이름으로 등록되는 작업 처리기.
 * <p>
 * 작업은 최소 한 번(at-least-once) 전달되므로 구현체는 같은 작업 ID를 두 번 받아도
 * 결과가 같도록 작성해야 합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface TaskHandler {

    String name();

    /**
     * 작업을 처리합니다. 예외를 던지면 재시도 정책에 따라 다시 실행됩니다.
     *
     * @param task 작업
     * @throws Exception 처리 실패
     */
    void handle(TaskEnvelope task) throws Exception;
}
