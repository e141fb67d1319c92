package com.fishcards.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 生成失败日志表 —— 审计 AI 调用失败，不含源文本与 API Key。
 */
@Table("t_generation_error_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationErrorLogEntity {

    @Id
    private Long id;

    private String userId;
    private String model;
    private String sourceTextHash;
    private Integer sourceTextLength;
    private String errorCode;
    private String errorMessage;
    private String createdAt;
}
