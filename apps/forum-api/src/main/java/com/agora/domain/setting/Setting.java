package com.agora.domain.setting;

import com.agora.domain.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 모듈 단위로 묶인 운영 설정 항목.
 * <p>
 * 값은 문자열로 저장하고, {@code valueType}은 관리 화면에서 입력 형식을 정할 때 참고합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Table(
    name = "setting",
    uniqueConstraints = @UniqueConstraint(name = "uk_setting_module_key", columnNames = {"module", "setting_key"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class Setting extends BaseEntity {

    @Column(name = "module", nullable = false, length = 50)
    private String module;

    @Column(name = "setting_key", nullable = false, length = 100)
    private String key;

    @Column(name = "setting_value", nullable = false, length = 1000)
    private String value;

    @Column(name = "value_type", nullable = false, length = 20)
    private String valueType;

    public Setting(String module, String key, String value, String valueType) {
        this.module = module;
        this.key = key;
        this.value = value;
        this.valueType = valueType;
    }

    public static Setting of(String module, String key, String value, String valueType) {
        return new Setting(module, key, value, valueType);
    }
}
