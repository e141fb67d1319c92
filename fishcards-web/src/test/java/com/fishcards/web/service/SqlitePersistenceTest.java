package com.fishcards.web.service;

import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.dto.PageResult;
import com.fishcards.common.exception.PersistenceException;
import com.fishcards.web.entity.GenerationEntity;
import com.fishcards.web.repository.GenerationErrorLogRepository;
import com.fishcards.web.repository.GenerationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 真实 SQLite 上跑 schema.sql、方言分页与派生查询。
 */
@DataJdbcTest(properties = {
        "spring.datasource.url=jdbc:sqlite::memory:",
        "spring.datasource.driver-class-name=org.sqlite.JDBC",
        // 内存库随连接存在，只保留一个连接
        "spring.datasource.hikari.maximum-pool-size=1",
        "spring.sql.init.mode=always"
})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JdbcGenerationStore.class, GenerationQueryService.class})
class SqlitePersistenceTest {

    @Autowired
    private JdbcGenerationStore store;

    @Autowired
    private GenerationQueryService queryService;

    @Autowired
    private GenerationRepository generationRepo;

    @Autowired
    private GenerationErrorLogRepository errorLogRepo;

    private static GenerationRecord record(String userId) {
        return GenerationRecord.builder()
                .userId(userId)
                .model("openai/gpt-4o-mini")
                .generatedCount(7)
                .sourceTextHash("ab".repeat(32))
                .sourceTextLength(2400)
                .generationDurationMs(3100)
                .build();
    }

    private void seedGeneration(String userId, String createdAt) {
        generationRepo.save(GenerationEntity.builder()
                .userId(userId)
                .model("openai/gpt-4o-mini")
                .generatedCount(3)
                .sourceTextHash("cd".repeat(32))
                .sourceTextLength(1500)
                .generationDurationMs(900L)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build());
    }

    private void seedErrorLog(String userId, String code) {
        store.insertErrorLog(ErrorLogEntry.builder()
                .userId(userId)
                .model("openai/gpt-4o-mini")
                .sourceTextHash("ef".repeat(32))
                .sourceTextLength(1200)
                .errorCode(code)
                .errorMessage("失败: " + code)
                .build());
    }

    @Test
    void insertGenerationAssignsIdAndTimestamps() {
        GenerationRecord saved = store.insertGeneration(record("user-1"));

        assertThat(saved.getId()).isNotNull();
        assertThat(saved.getCreatedAt()).isEqualTo("2026-03-01 08:15:30");
        assertThat(saved.getUpdatedAt()).isEqualTo(saved.getCreatedAt());
        assertThat(generationRepo.findById(saved.getId()))
                .hasValueSatisfying(e -> {
                    assertThat(e.getAcceptedUneditedCount()).isZero();
                    assertThat(e.getSourceTextLength()).isEqualTo(2400);
                });
    }

    @Test
    @DisplayName("CHECK 约束拒绝的行转为 PersistenceException")
    void checkConstraintViolationBecomesPersistenceException() {
        GenerationRecord tooShort = record("user-1").toBuilder().sourceTextLength(10).build();

        assertThatThrownBy(() -> store.insertGeneration(tooShort))
                .isInstanceOfSatisfying(PersistenceException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo("DATABASE_ERROR"));
    }

    @Test
    @DisplayName("LIMIT/OFFSET 分页按用户隔离")
    void pagesThroughOneUsersGenerations() {
        for (int i = 1; i <= 5; i++) {
            seedGeneration("user-1", "2026-03-01 08:00:0" + i);
        }
        seedGeneration("user-2", "2026-03-01 09:00:00");

        PageResult<GenerationRecord> second = queryService.getGenerations("user-1", 2, 2, "created_at", "desc");
        assertThat(second.getData()).extracting(GenerationRecord::getCreatedAt)
                .containsExactly("2026-03-01 08:00:03", "2026-03-01 08:00:02");
        assertThat(second.getPagination().getTotal()).isEqualTo(5);
        assertThat(second.getPagination().getTotalPages()).isEqualTo(3);

        PageResult<GenerationRecord> last = queryService.getGenerations("user-1", 3, 2, "created_at", "desc");
        assertThat(last.getData()).extracting(GenerationRecord::getCreatedAt).containsExactly("2026-03-01 08:00:01");

        PageResult<GenerationRecord> ascending = queryService.getGenerations("user-1", 1, 10, "updated_at", "asc");
        assertThat(ascending.getData()).hasSize(5);
        assertThat(ascending.getData().get(0).getCreatedAt()).isEqualTo("2026-03-01 08:00:01");
    }

    @Test
    void foreignGenerationIsInvisible() {
        GenerationRecord saved = store.insertGeneration(record("user-1"));

        assertThat(queryService.getGeneration("user-1", saved.getId())).isPresent();
        assertThat(queryService.getGeneration("user-2", saved.getId())).isEmpty();
    }

    @Test
    @DisplayName("同一秒写入的错误日志按 id 倒序")
    void errorLogsNewestFirstWithIdTiebreak() {
        seedErrorLog("user-1", "AI_API_ERROR");
        seedErrorLog("user-1", "RATE_LIMIT_EXCEEDED");
        seedErrorLog("user-1", "INTERNAL_SERVER_ERROR");
        seedErrorLog("user-2", "AI_API_ERROR");

        PageResult<ErrorLogEntry> page = queryService.getErrorLogs("user-1", 1, 2);

        List<String> codes = page.getData().stream().map(ErrorLogEntry::getErrorCode).toList();
        assertThat(codes).containsExactly("INTERNAL_SERVER_ERROR", "RATE_LIMIT_EXCEEDED");
        assertThat(page.getPagination().getTotal()).isEqualTo(3);
        assertThat(errorLogRepo.countByUserId("user-2")).isEqualTo(1);
    }
}
