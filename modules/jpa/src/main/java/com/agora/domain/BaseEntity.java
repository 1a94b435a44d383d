package com.agora.domain;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;

import java.time.ZonedDateTime;

/**
 * 생성/수정/삭제 시각을 관리하는 엔티티 기반 클래스.
 * <p>
 * 식별자는 데이터베이스 IDENTITY 전략으로 발급됩니다.
 * 저장 직전 {@link #guard()}가 호출되므로 하위 엔티티는 불변식 검증을 이곳에 둘 수 있습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@MappedSuperclass
@Getter
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private ZonedDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;

    @Column(name = "deleted_at")
    private ZonedDateTime deletedAt;

    /**
     * 저장/수정 직전 엔티티 상태를 검증합니다.
     * <p>
     * 기본 구현은 아무것도 하지 않습니다.
     * </p>
     */
    protected void guard() {
    }

    @PrePersist
    private void prePersist() {
        guard();
        ZonedDateTime now = ZonedDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        guard();
        this.updatedAt = ZonedDateTime.now();
    }

    /**
     * 소프트 삭제합니다. 이미 삭제된 경우 아무것도 하지 않습니다.
     */
    public void delete() {
        if (this.deletedAt == null) {
            this.deletedAt = ZonedDateTime.now();
        }
    }
}
