package com.duoim.domain.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        ChatProperties.class,
        ClientMsgIdCaffeineProperties.class,
        CacheProperties.class
})
public class DomainConfig {
}
