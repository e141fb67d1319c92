package com.fishcards.web.service;

import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.exception.PersistenceException;
import com.fishcards.common.store.GenerationStore;
import com.fishcards.web.entity.GenerationEntity;
import com.fishcards.web.entity.GenerationErrorLogEntity;
import com.fishcards.web.repository.GenerationErrorLogRepository;
import com.fishcards.web.repository.GenerationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 基于 Spring Data JDBC 的生成记录存储，只做插入。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JdbcGenerationStore implements GenerationStore {

    static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final GenerationRepository generationRepo;
    private final GenerationErrorLogRepository errorLogRepo;
    private final Clock systemClock;

    @Override
    public GenerationRecord insertGeneration(GenerationRecord record) {
        String now = LocalDateTime.now(systemClock).format(SQLITE_FMT);
        GenerationEntity entity = GenerationEntity.builder()
                .userId(record.getUserId())
                .model(record.getModel())
                .generatedCount(record.getGeneratedCount())
                .acceptedUneditedCount(record.getAcceptedUneditedCount())
                .acceptedEditedCount(record.getAcceptedEditedCount())
                .sourceTextHash(record.getSourceTextHash())
                .sourceTextLength(record.getSourceTextLength())
                .generationDurationMs(record.getGenerationDurationMs())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            GenerationEntity saved = generationRepo.save(entity);
            log.debug("生成记录已保存: id={}, userId={}", saved.getId(), saved.getUserId());
            return toRecord(saved);
        } catch (DataAccessException e) {
            log.error("保存生成记录失败: {}", e.getMessage());
            throw new PersistenceException("写入生成记录失败", e);
        }
    }

    @Override
    public void insertErrorLog(ErrorLogEntry entry) {
        GenerationErrorLogEntity entity = GenerationErrorLogEntity.builder()
                .userId(entry.getUserId())
                .model(entry.getModel())
                .sourceTextHash(entry.getSourceTextHash())
                .sourceTextLength(entry.getSourceTextLength())
                .errorCode(entry.getErrorCode())
                .errorMessage(entry.getErrorMessage())
                .createdAt(LocalDateTime.now(systemClock).format(SQLITE_FMT))
                .build();
        errorLogRepo.save(entity);
    }

    // ==================== 映射 ====================

    static GenerationRecord toRecord(GenerationEntity e) {
        return GenerationRecord.builder()
                .id(e.getId())
                .userId(e.getUserId())
                .model(e.getModel())
                .generatedCount(nullToZero(e.getGeneratedCount()))
                .acceptedUneditedCount(nullToZero(e.getAcceptedUneditedCount()))
                .acceptedEditedCount(nullToZero(e.getAcceptedEditedCount()))
                .sourceTextHash(e.getSourceTextHash())
                .sourceTextLength(nullToZero(e.getSourceTextLength()))
                .generationDurationMs(e.getGenerationDurationMs() != null ? e.getGenerationDurationMs() : 0L)
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }

    static ErrorLogEntry toEntry(GenerationErrorLogEntity e) {
        return ErrorLogEntry.builder()
                .id(e.getId())
                .userId(e.getUserId())
                .model(e.getModel())
                .sourceTextHash(e.getSourceTextHash())
                .sourceTextLength(nullToZero(e.getSourceTextLength()))
                .errorCode(e.getErrorCode())
                .errorMessage(e.getErrorMessage())
                .createdAt(e.getCreatedAt())
                .build();
    }

    private static int nullToZero(Integer value) {
        return value != null ? value : 0;
    }
}
