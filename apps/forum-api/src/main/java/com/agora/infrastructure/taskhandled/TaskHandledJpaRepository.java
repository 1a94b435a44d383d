package com.agora.infrastructure.taskhandled;

import com.agora.domain.taskhandled.TaskHandled;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskHandledJpaRepository extends JpaRepository<TaskHandled, String> {
}
