package com.agora.infrastructure.taskhandled;

import com.agora.domain.taskhandled.TaskHandled;
import com.agora.domain.taskhandled.TaskHandledRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class TaskHandledRepositoryImpl implements TaskHandledRepository {
    private final TaskHandledJpaRepository taskHandledJpaRepository;

    @Override
    public TaskHandled save(TaskHandled taskHandled) {
        // 할당 ID 엔티티라 save()는 merge로 동작하므로 중복을 감지하지 못한다
        if (taskHandledJpaRepository.existsById(taskHandled.getTaskId())) {
            throw new DataIntegrityViolationException(
                "이미 처리된 작업입니다: taskId=" + taskHandled.getTaskId());
        }
        return taskHandledJpaRepository.saveAndFlush(taskHandled);
    }

    @Override
    public boolean existsByTaskId(String taskId) {
        return taskHandledJpaRepository.existsById(taskId);
    }
}
