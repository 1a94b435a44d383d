package com.agora.task;

import java.time.Duration;

/**
 * 고정 주기로 실행되는 작업.
 * <p>
 * 스케줄러는 주기마다 작업을 큐에 넣을 뿐이며, 실행은 일반 작업과 같은 워커 풀이 맡습니다.
 * 이전 실행이 아직 대기 중이거나 실행 중이면 그 주기는 건너뜁니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface RecurringTask extends TaskHandler {

    Duration interval();

    /**
     * @return 시작 직후 첫 주기를 기다리지 않고 바로 실행할지 여부
     */
    default boolean runOnStart() {
        return false;
    }
}
