package com.agora.domain.setting;

import java.util.List;

/**
 * Setting 엔티티에 대한 저장소 인터페이스.
 *
 * @author Agora
 * @version 1.0
 */
public interface SettingRepository {

    /**
     * 모듈에 속한 설정을 모두 조회합니다.
     *
     * @param module 모듈 이름 (예: "signin")
     * @return 설정 목록
     */
    List<Setting> findAllByModule(String module);
}
