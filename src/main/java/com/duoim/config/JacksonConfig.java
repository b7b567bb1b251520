package com.duoim.config;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    /**
     * 雪花 id 超过 JS Number 安全范围，id 语义的 long 字段统一输出为字符串。
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer idLongJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer serializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, serializer);
            builder.serializerByType(Long.TYPE, serializer);
        };
    }
}
