package com.haven.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {
        "com.haven.gateway",
        "com.haven.common.exception",
        "com.haven.common.security",
        "com.haven.common.resilience"
})
@ConfigurationPropertiesScan("com.haven.gateway.config")
public class GatewayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayServiceApplication.class, args);
    }
}
