package com.agora.testcontainers;

import org.springframework.context.annotation.Configuration;
import org.testcontainers.containers.MySQLContainer;

/**
 * MySQL Testcontainers 설정.
 * <p>
 * 테스트 실행 시 MySQL 컨테이너를 한 번 띄우고,
 * jpa.yml의 {@code datasource.mysql-jpa.main} 접속 정보를 컨테이너 값으로 덮어씁니다.
 * </p>
 * <p>
 * <b>동작 방식:</b>
 * 1. MySQL 컨테이너를 시작
 * 2. 동적으로 할당된 JDBC URL과 계정을 System Property로 설정
 * 3. System Property가 yml보다 우선하므로 Hikari 설정이 이 값을 사용
 * </p>
 */
@Configuration
public class MySqlTestContainersConfig {

    private static final MySQLContainer<?> mySqlContainer;

    static {
        mySqlContainer = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("agora")
            .withUsername("application")
            .withPassword("application");
        mySqlContainer.start();

        System.setProperty("datasource.mysql-jpa.main.jdbc-url", mySqlContainer.getJdbcUrl());
        System.setProperty("datasource.mysql-jpa.main.username", mySqlContainer.getUsername());
        System.setProperty("datasource.mysql-jpa.main.password", mySqlContainer.getPassword());
    }
}
