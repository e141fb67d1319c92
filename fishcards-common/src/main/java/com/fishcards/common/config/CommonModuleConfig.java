package com.fishcards.common.config;

import com.fishcards.common.logging.GenerationLogger;
import com.fishcards.common.logging.GenerationLoggingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 公共模块配置：注册结构化日志组件。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GenerationLoggingProperties.class)
public class CommonModuleConfig {

    @Bean
    public GenerationLogger generationLogger(GenerationLoggingProperties properties) {
        GenerationLogger logger = new GenerationLogger(properties.isDevelopment(), properties.getLevel());
        log.info("结构化日志: 开发模式={}, 最低级别={}", logger.isDevelopment(), logger.getMinLevel());
        return logger;
    }
}
