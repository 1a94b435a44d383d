package com.agora.lock;

/**
 * 획득한 락의 소유권 증표.
 * <p>
 * {@code value}는 획득 시 발급한 고유 값이며, 해제 시 저장된 값과 일치할 때만 락이 삭제됩니다.
 * </p>
 *
 * @param key 락 키
 * @param value 소유자 고유 값
 * @author Agora
 * @version 1.0
 */
public record LockToken(String key, String value) {
}
