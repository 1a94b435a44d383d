package com.agora.domain.balance;

/**
 * 잔액을 변경한 관리자. 시스템이 변경한 경우에는 operator 자체가 null입니다.
 *
 * @param id 관리자 ID
 * @param name 관리자 이름
 */
public record BalanceOperator(Long id, String name) {
}
