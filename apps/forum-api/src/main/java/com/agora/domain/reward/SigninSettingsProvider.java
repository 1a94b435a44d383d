package com.agora.domain.reward;

/**
 * 출석 설정 제공자.
 * <p>
 * 구현체는 설정을 캐시할 수 있으며, 캐시된 값은 최대 TTL만큼 오래된 값일 수 있습니다.
 * 관리자가 설정을 바꾼 직후 바로 반영하려면 {@link #refresh()}를 호출합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface SigninSettingsProvider {

    SigninSettings current();

    /**
     * 캐시를 비워 다음 {@link #current()} 호출이 저장소를 다시 읽게 합니다.
     */
    void refresh();
}
