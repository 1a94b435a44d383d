package com.agora.domain.taskhandled;

/**
 * TaskHandled 엔티티에 대한 저장소 인터페이스.
 *
 * @author Agora
 * @version 1.0
 */
public interface TaskHandledRepository {

    /**
     * 처리 기록을 저장합니다.
     *
     * @param taskHandled 처리 기록
     * @return 저장된 처리 기록
     * @throws org.springframework.dao.DataIntegrityViolationException 이미 기록된 작업인 경우
     */
    TaskHandled save(TaskHandled taskHandled);

    boolean existsByTaskId(String taskId);
}
