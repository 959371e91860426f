package com.identityguardian.groupsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
    "com.identityguardian.groupsync",
    "com.identityguardian.common"
})
public class GroupSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupSyncServiceApplication.class, args);
    }
}
