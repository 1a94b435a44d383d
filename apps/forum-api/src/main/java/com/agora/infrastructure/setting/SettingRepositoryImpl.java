package com.agora.infrastructure.setting;

import com.agora.domain.setting.Setting;
import com.agora.domain.setting.SettingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@RequiredArgsConstructor
@Component
public class SettingRepositoryImpl implements SettingRepository {
    private final SettingJpaRepository settingJpaRepository;

    @Override
    public List<Setting> findAllByModule(String module) {
        return settingJpaRepository.findAllByModule(module);
    }
}
