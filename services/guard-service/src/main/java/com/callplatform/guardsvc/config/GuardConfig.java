package com.callplatform.guardsvc.config;

import com.callplatform.guardsvc.domain.ratelimit.IdentifierResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(GuardProperties.class)
public class GuardConfig {

    @Bean
    @ConditionalOnMissingBean
    public IdentifierResolver identifierResolver() {
        return IdentifierResolver.DEFAULT;
    }
}
