package com.agora.application.taskhandled;

import com.agora.domain.taskhandled.TaskHandled;
import com.agora.domain.taskhandled.TaskHandledRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskHandledServiceTest {

    @Mock
    private TaskHandledRepository taskHandledRepository;

    @InjectMocks
    private TaskHandledService taskHandledService;

    @DisplayName("처리 기록이 있는 작업은 true를 반환한다.")
    @Test
    void isAlreadyHandled_returnsTrue_whenRecorded() {
        // arrange
        when(taskHandledRepository.existsByTaskId("task-1")).thenReturn(true);

        // act & assert
        assertThat(taskHandledService.isAlreadyHandled("task-1")).isTrue();
    }

    @DisplayName("처리되지 않은 작업은 기록이 저장된다.")
    @Test
    void markAsHandled_saves() {
        // arrange
        when(taskHandledRepository.save(any(TaskHandled.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // act
        taskHandledService.markAsHandled("task-1", "signin.reward");

        // assert
        verify(taskHandledRepository).save(any(TaskHandled.class));
    }

    @DisplayName("이미 처리된 작업을 기록하면 DataIntegrityViolationException을 그대로 던진다.")
    @Test
    void markAsHandled_throws_whenDuplicated() {
        // arrange
        when(taskHandledRepository.save(any(TaskHandled.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate task_id"));

        // act & assert
        assertThatThrownBy(() -> taskHandledService.markAsHandled("task-1", "signin.reward"))
            .isInstanceOf(DataIntegrityViolationException.class);
    }
}
