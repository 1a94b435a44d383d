package com.agora.domain.balance;

import com.agora.domain.BaseEntity;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * 잔액 변경 장부 항목.
 * <p>
 * 한 번 기록되면 수정하거나 삭제하지 않는 감사 기록입니다.
 * {@code afterAmount = beforeAmount + amount}는 생성 시점에 검증하며 이후 다시 계산하지 않습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Immutable
@Table(name = "balance_log", indexes = {
    @Index(name = "idx_balance_log_user", columnList = "user_id, created_at"),
    @Index(name = "idx_balance_log_related", columnList = "related_type, related_id")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class BalanceLog extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20, updatable = false)
    private BalanceType type;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "before_amount", nullable = false, updatable = false)
    private long beforeAmount;

    @Column(name = "after_amount", nullable = false, updatable = false)
    private long afterAmount;

    @Column(name = "reason", nullable = false, length = 255, updatable = false)
    private String reason;

    @Column(name = "operator_id", updatable = false)
    private Long operatorId;

    @Column(name = "operator_name", length = 100, updatable = false)
    private String operatorName;

    @Column(name = "related_id", length = 64, updatable = false)
    private String relatedId;

    @Column(name = "related_type", length = 50, updatable = false)
    private String relatedType;

    private BalanceLog(BalanceChangeCommand command, long beforeAmount, long afterAmount) {
        this.userId = command.userId();
        this.type = command.type();
        this.amount = command.amount();
        this.beforeAmount = beforeAmount;
        this.afterAmount = afterAmount;
        this.reason = command.reason();
        this.relatedId = command.relatedId();
        this.relatedType = command.relatedType();
        if (command.operator() != null) {
            this.operatorId = command.operator().id();
            this.operatorName = command.operator().name();
        }
    }

    /**
     * 장부 항목을 만듭니다.
     *
     * @param command 변경 요청
     * @param beforeAmount 변경 전 잔액
     * @param afterAmount 변경 후 잔액
     * @return 장부 항목
     * @throws CoreException 변경 전후 잔액이 변경량과 맞지 않거나 사유가 비어 있는 경우
     */
    public static BalanceLog of(BalanceChangeCommand command, long beforeAmount, long afterAmount) {
        if (afterAmount - beforeAmount != command.amount()) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, String.format(
                "장부 금액 불일치 (before: %d, amount: %d, after: %d)", beforeAmount, command.amount(), afterAmount));
        }
        if (command.reason() == null || command.reason().isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "잔액 변경 사유는 필수입니다.");
        }
        return new BalanceLog(command, beforeAmount, afterAmount);
    }

    public boolean isSystemInitiated() {
        return operatorId == null;
    }
}
