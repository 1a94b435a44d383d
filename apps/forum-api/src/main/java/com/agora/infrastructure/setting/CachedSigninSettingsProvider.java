package com.agora.infrastructure.setting;

import com.agora.cache.CacheKey;
import com.agora.cache.CacheTemplate;
import com.agora.config.SigninProperties;
import com.agora.domain.reward.RewardMode;
import com.agora.domain.reward.SigninSettings;
import com.agora.domain.reward.SigninSettingsProvider;
import com.agora.domain.setting.Setting;
import com.agora.domain.setting.SettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 설정 테이블의 {@code signin} 모듈을 읽어 Redis에 캐시하는 {@link SigninSettingsProvider}.
 * <p>
 * <b>설정 키:</b>
 * <ul>
 *   <li>is_enable: 출석 기능 사용 여부</li>
 *   <li>mode: fixed / increment / random</li>
 *   <li>fixed_reward, increment_base, increment_step, increment_cycle, random_min, random_max</li>
 *   <li>experience_reward: 출석마다 지급하는 경험치</li>
 * </ul>
 * 없거나 형식이 잘못된 키는 기본값을 사용합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class CachedSigninSettingsProvider implements SigninSettingsProvider {

    static final String MODULE = "signin";
    private static final String CACHE_NAMESPACE = "settings";
    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private final SettingRepository settingRepository;
    private final CacheTemplate cacheTemplate;
    private final CacheKey<SigninSettings> cacheKey;

    public CachedSigninSettingsProvider(
        SettingRepository settingRepository,
        CacheTemplate cacheTemplate,
        SigninProperties signinProperties
    ) {
        this.settingRepository = settingRepository;
        this.cacheTemplate = cacheTemplate;
        this.cacheKey = CacheKey.of(CACHE_NAMESPACE, MODULE, signinProperties.settingsCacheTtl(), SigninSettings.class);
    }

    @Override
    public SigninSettings current() {
        return cacheTemplate.getOrLoad(cacheKey, this::load);
    }

    @Override
    public void refresh() {
        cacheTemplate.evict(cacheKey);
    }

    private SigninSettings load() {
        List<Setting> settings = settingRepository.findAllByModule(MODULE);
        Map<String, String> values = new HashMap<>();
        for (Setting setting : settings) {
            values.put(setting.getKey(), setting.getValue());
        }

        SigninSettings defaults = SigninSettings.defaults();
        return new SigninSettings(
            parseBoolean(values, "is_enable", defaults.enabled()),
            parseMode(values, defaults.mode()),
            parseInt(values, "fixed_reward", defaults.fixedReward()),
            parseInt(values, "increment_base", defaults.incrementBase()),
            parseInt(values, "increment_step", defaults.incrementStep()),
            parseInt(values, "increment_cycle", defaults.incrementCycle()),
            parseInt(values, "random_min", defaults.randomMin()),
            parseInt(values, "random_max", defaults.randomMax()),
            parseInt(values, "experience_reward", defaults.experienceReward())
        );
    }

    private boolean parseBoolean(Map<String, String> values, String key, boolean defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return TRUE_VALUES.contains(raw.trim().toLowerCase());
    }

    private RewardMode parseMode(Map<String, String> values, RewardMode defaultValue) {
        String raw = values.get("mode");
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return RewardMode.fromSettingValue(raw).orElseGet(() -> {
            log.warn("알 수 없는 출석 보상 모드, 기본값 사용: mode={}, default={}", raw, defaultValue);
            return defaultValue;
        });
    }

    private int parseInt(Map<String, String> values, String key, int defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("출석 설정 값이 정수가 아님, 기본값 사용: key={}, value={}, default={}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
