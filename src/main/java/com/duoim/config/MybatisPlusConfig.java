package com.duoim.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.duoim.**.mapper")
public class MybatisPlusConfig {
}
