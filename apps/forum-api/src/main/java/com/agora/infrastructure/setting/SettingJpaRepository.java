package com.agora.infrastructure.setting;

import com.agora.domain.setting.Setting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SettingJpaRepository extends JpaRepository<Setting, Long> {

    List<Setting> findAllByModule(String module);
}
