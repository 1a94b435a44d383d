package com.agora.domain.balance;

/**
 * 잔액 장부가 기록하는 자산 종류.
 */
public enum BalanceType {
    POINTS,
    CURRENCY
}
