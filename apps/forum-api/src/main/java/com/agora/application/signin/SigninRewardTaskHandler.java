package com.agora.application.signin;

import com.agora.application.taskhandled.TaskHandledService;
import com.agora.domain.balance.BalanceService;
import com.agora.task.TaskEnvelope;
import com.agora.task.TaskHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 출석 후속 처리 작업 핸들러.
 * <p>
 * 출석 시 계산해 둔 경험치를 지급합니다.
 * 작업 큐는 같은 작업을 두 번 전달할 수 있으므로 작업 ID로 처리 여부를 확인하고,
 * 지급과 처리 기록을 같은 트랜잭션에 묶습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SigninRewardTaskHandler implements TaskHandler {
    public static final String TASK_NAME = "signin.reward";

    private final TaskHandledService taskHandledService;
    private final BalanceService balanceService;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return TASK_NAME;
    }

    @Transactional
    @Override
    public void handle(TaskEnvelope task) {
        if (taskHandledService.isAlreadyHandled(task.id())) {
            log.info("이미 처리된 출석 후속 작업, 건너뜀: taskId={}", task.id());
            return;
        }

        SigninRewardPayload payload = task.payloadAs(objectMapper, SigninRewardPayload.class);
        if (payload.experience() > 0) {
            long experience = balanceService.grantExperience(payload.userId(), payload.experience());
            log.debug("출석 경험치 지급: userId={}, date={}, amount={}, total={}",
                payload.userId(), payload.signDate(), payload.experience(), experience);
        }
        taskHandledService.markAsHandled(task.id(), TASK_NAME);
    }
}
