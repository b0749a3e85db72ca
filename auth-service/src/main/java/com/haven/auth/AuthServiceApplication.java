package com.haven.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {
        "com.haven.auth",
        "com.haven.common.exception",
        "com.haven.common.outbox",
        "com.haven.common.saga"
})
@EnableScheduling  // outbox relay polling
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
