package com.agora;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.TimeZone;

@ConfigurationPropertiesScan
@SpringBootApplication
public class ForumApiApplication {

    @Value("${agora.signin.zone:Asia/Seoul}")
    private String signinZone;

    @PostConstruct
    public void started() {
        // 로그와 JDBC 타임스탬프도 출석 날짜와 같은 시간대로 맞춘다
        TimeZone.setDefault(TimeZone.getTimeZone(signinZone));
    }

    public static void main(String[] args) {
        SpringApplication.run(ForumApiApplication.class, args);
    }
}
