package com.haven.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {
        "com.haven.chat",
        "com.haven.common.exception",
        "com.haven.common.security",
        "com.haven.common.saga"
})
@ConfigurationPropertiesScan("com.haven.chat.config")
public class ChatServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatServiceApplication.class, args);
    }
}
