package com.agora.domain.balance;

/**
 * 잔액 변경 요청.
 *
 * @param userId 사용자 ID
 * @param type 자산 종류
 * @param amount 변경량 (음수면 차감)
 * @param reason 변경 사유
 * @param relatedType 관련 엔티티 종류 (예: "signin"), 없으면 null
 * @param relatedId 관련 엔티티 ID, 없으면 null
 * @param operator 변경한 관리자, 시스템 변경이면 null
 */
public record BalanceChangeCommand(
    String userId,
    BalanceType type,
    long amount,
    String reason,
    String relatedType,
    String relatedId,
    BalanceOperator operator
) {

    public static BalanceChangeCommand bySystem(
        String userId, BalanceType type, long amount, String reason, String relatedType, String relatedId
    ) {
        return new BalanceChangeCommand(userId, type, amount, reason, relatedType, relatedId, null);
    }
}
