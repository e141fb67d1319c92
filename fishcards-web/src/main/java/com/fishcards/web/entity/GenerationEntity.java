package com.fishcards.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 生成记录表，只插入。
 */
@Table("t_generation")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationEntity {

    @Id
    private Long id;

    private String userId;
    private String model;
    private Integer generatedCount;

    @Builder.Default
    private Integer acceptedUneditedCount = 0;

    @Builder.Default
    private Integer acceptedEditedCount = 0;

    private String sourceTextHash;
    private Integer sourceTextLength;
    private Long generationDurationMs;

    /** yyyy-MM-dd HH:mm:ss，字典序即时间序 */
    private String createdAt;
    private String updatedAt;
}
