package com.fishcards.common.logging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 结构化日志配置项。
 */
@Data
@ConfigurationProperties(prefix = "fishcards.logging")
public class GenerationLoggingProperties {

    /** 开发模式：彩色单行输出、完整显示用户 ID、默认 DEBUG 级别 */
    private boolean development = false;

    /** 最低输出级别，不配置时按模式取默认值 */
    private LogLevel level;
}
