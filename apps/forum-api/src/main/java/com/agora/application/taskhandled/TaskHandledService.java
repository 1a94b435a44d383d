package com.agora.application.taskhandled;

import com.agora.domain.taskhandled.TaskHandled;
import com.agora.domain.taskhandled.TaskHandledRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 작업 처리 기록 서비스.
 * <p>
 * 작업 핸들러의 멱등성을 보장합니다.
 * 처리 전 작업 ID가 이미 기록되었는지 확인하고, 처리와 같은 트랜잭션에서 기록을 남깁니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskHandledService {

    private final TaskHandledRepository taskHandledRepository;

    @Transactional(readOnly = true)
    public boolean isAlreadyHandled(String taskId) {
        return taskHandledRepository.existsByTaskId(taskId);
    }

    /**
     * 작업 처리 기록을 저장합니다.
     *
     * @param taskId 작업 ID
     * @param taskName 작업 이름
     * @throws DataIntegrityViolationException 이미 처리된 작업인 경우
     */
    @Transactional
    public void markAsHandled(String taskId, String taskName) {
        try {
            taskHandledRepository.save(new TaskHandled(taskId, taskName));
            log.debug("작업 처리 기록 저장: taskId={}, taskName={}", taskId, taskName);
        } catch (DataIntegrityViolationException e) {
            log.warn("작업이 이미 처리되었습니다: taskId={}", taskId);
            throw e;
        }
    }
}
