package com.agora.application.signin;

import com.agora.application.taskhandled.TaskHandledService;
import com.agora.domain.balance.BalanceService;
import com.agora.task.TaskEnvelope;
import com.agora.task.TaskSerializationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SigninRewardTaskHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Mock
    private TaskHandledService taskHandledService;

    @Mock
    private BalanceService balanceService;

    private SigninRewardTaskHandler handler;

    @BeforeEach
    void setUp() {
        handler = new SigninRewardTaskHandler(taskHandledService, balanceService, objectMapper);
    }

    private TaskEnvelope envelope(SigninRewardPayload payload) throws Exception {
        return TaskEnvelope.create(SigninRewardTaskHandler.TASK_NAME, objectMapper.writeValueAsString(payload));
    }

    @DisplayName("처음 받은 작업이면 출석 때 계산한 경험치를 지급하고 처리 기록을 남긴다.")
    @Test
    void grantsExperience_andMarksHandled() throws Exception {
        // arrange
        TaskEnvelope task = envelope(new SigninRewardPayload("user-1", LocalDate.of(2024, 12, 15), 22, 5));
        when(taskHandledService.isAlreadyHandled(task.id())).thenReturn(false);

        // act
        handler.handle(task);

        // assert
        verify(balanceService).grantExperience("user-1", 5);
        verify(taskHandledService).markAsHandled(task.id(), SigninRewardTaskHandler.TASK_NAME);
    }

    @DisplayName("이미 처리한 작업이면 경험치를 다시 지급하지 않는다.")
    @Test
    void skips_whenAlreadyHandled() throws Exception {
        // arrange
        TaskEnvelope task = envelope(new SigninRewardPayload("user-1", LocalDate.of(2024, 12, 15), 22, 5));
        when(taskHandledService.isAlreadyHandled(task.id())).thenReturn(true);

        // act
        handler.handle(task);

        // assert
        verify(balanceService, never()).grantExperience(anyString(), anyLong());
        verify(taskHandledService, never()).markAsHandled(anyString(), anyString());
    }

    @DisplayName("경험치가 0이면 지급 없이 처리 기록만 남긴다.")
    @Test
    void onlyMarksHandled_whenNoExperience() throws Exception {
        // arrange
        TaskEnvelope task = envelope(new SigninRewardPayload("user-1", LocalDate.of(2024, 12, 15), 22, 0));
        when(taskHandledService.isAlreadyHandled(task.id())).thenReturn(false);

        // act
        handler.handle(task);

        // assert
        verify(balanceService, never()).grantExperience(anyString(), anyLong());
        verify(taskHandledService).markAsHandled(task.id(), SigninRewardTaskHandler.TASK_NAME);
    }

    @DisplayName("페이로드 형식이 맞지 않으면 예외를 던져 재시도/데드 레터로 넘긴다.")
    @Test
    void throws_whenPayloadIsMalformed() {
        // arrange
        TaskEnvelope task = TaskEnvelope.create(SigninRewardTaskHandler.TASK_NAME, "not-json");
        when(taskHandledService.isAlreadyHandled(task.id())).thenReturn(false);

        // act & assert
        assertThrows(TaskSerializationException.class, () -> handler.handle(task));
        verify(taskHandledService, never()).markAsHandled(anyString(), anyString());
    }
}
