package com.agora.domain.taskhandled;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 비동기 작업 처리 기록 엔티티.
 * <p>
 * 작업 큐는 최소 한 번 전달을 보장하므로 같은 작업이 두 번 실행될 수 있습니다.
 * 작업 ID를 Primary Key로 저장해 후속 처리가 한 번만 반영되도록 합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Table(name = "task_handled", indexes = {
    @Index(name = "idx_task_handled_at", columnList = "handled_at")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class TaskHandled {

    @Id
    @Column(name = "task_id", nullable = false, length = 64)
    private String taskId;

    @Column(name = "task_name", nullable = false, length = 100)
    private String taskName;

    @Column(name = "handled_at", nullable = false)
    private LocalDateTime handledAt;

    /**
     * @param taskId 작업 ID
     * @param taskName 작업 이름 (예: "signin.reward")
     */
    public TaskHandled(String taskId, String taskName) {
        this.taskId = taskId;
        this.taskName = taskName;
        this.handledAt = LocalDateTime.now();
    }
}
