package com.goormthonuniv.videocheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;

// API 키 같은 비밀값은 커밋하지 않는 env.properties 에서 (없으면 무시)
@SpringBootApplication
@PropertySource(value = "classpath:properties/env.properties", ignoreResourceNotFound = true)
public class VideoCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoCheckApplication.class, args);
    }
}
