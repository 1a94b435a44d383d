package com.agora.domain.balance;

/**
 * BalanceLog 엔티티에 대한 저장소 인터페이스.
 * <p>
 * 장부는 추가만 가능합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface BalanceLogRepository {

    BalanceLog save(BalanceLog balanceLog);
}
