package com.identityguardian.groupsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GroupSyncProperties.class)
public class GroupSyncConfig {

    private static final Logger log = LoggerFactory.getLogger(GroupSyncConfig.class);

    @Bean
    public ObjectMapper objectMapper(GroupSyncProperties properties) {
        log.info("Group sync configured. prefix={} mappedRoles={} purgeConcurrency={}",
            properties.prefix(), properties.roleGroupMap().size(), properties.purgeConcurrency());
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
