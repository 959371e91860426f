package com.identityguardian.mitigation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
    "com.identityguardian.mitigation",
    "com.identityguardian.common"
})
public class MitigationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MitigationServiceApplication.class, args);
    }
}
