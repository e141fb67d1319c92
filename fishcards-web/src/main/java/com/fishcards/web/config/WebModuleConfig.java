package com.fishcards.web.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

import java.time.Clock;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.fishcards.web")
public class WebModuleConfig {

    /**
     * 注册 SQLite 方言。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /** 记录时间戳使用的时钟 */
    @Bean
    public Clock systemClock() {
        return Clock.systemDefaultZone();
    }
}
